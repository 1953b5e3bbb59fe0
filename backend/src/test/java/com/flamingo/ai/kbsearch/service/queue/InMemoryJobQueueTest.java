package com.flamingo.ai.kbsearch.service.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.domain.enums.IngestionMode;
import com.flamingo.ai.kbsearch.exception.QueueException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemoryJobQueueTest {

  private MutableClock clock;
  private InMemoryJobQueue queue;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-03-02T09:00:00Z"));
    queue = new InMemoryJobQueue(new IngestionConfig().getQueue(), clock);
  }

  private static IngestionJob job(String target) {
    return IngestionJob.create(IngestionMode.INCREMENTAL, "sentence-transformer", target);
  }

  @Nested
  @DisplayName("delivery")
  class Delivery {

    @Test
    @DisplayName("should deliver jobs in enqueue order")
    void shouldDeliverFifo() {
      IngestionJob first = job("_Gare");
      IngestionJob second = job("_AQ");
      queue.enqueue(first);
      queue.enqueue(second);

      assertThat(queue.dequeue(Duration.ZERO)).contains(first);
      assertThat(queue.dequeue(Duration.ZERO)).contains(second);
      assertThat(queue.dequeue(Duration.ZERO)).isEmpty();
      assertThat(queue.stats()).isEqualTo(new QueueStats(0, 2, 0));
    }

    @Test
    @DisplayName("should forget an acknowledged job")
    void shouldAck() {
      IngestionJob job = job("_Gare");
      queue.enqueue(job);
      queue.dequeue(Duration.ZERO);

      queue.ack(job.jobId());
      clock.advance(Duration.ofHours(2));

      assertThat(queue.reclaimExpired()).isZero();
      assertThat(queue.stats()).isEqualTo(new QueueStats(0, 0, 0));
    }
  }

  @Nested
  @DisplayName("redelivery")
  class Redelivery {

    @Test
    @DisplayName("should return an expired lease to the queue with the attempt incremented")
    void shouldReclaimExpiredLease() {
      IngestionJob job = job("_Gare");
      queue.enqueue(job);
      queue.dequeue(Duration.ZERO);

      clock.advance(Duration.ofMinutes(29));
      assertThat(queue.reclaimExpired()).isZero();

      clock.advance(Duration.ofMinutes(2));
      assertThat(queue.reclaimExpired()).isEqualTo(1);

      IngestionJob redelivered = queue.dequeue(Duration.ZERO).orElseThrow();
      assertThat(redelivered.jobId()).isEqualTo(job.jobId());
      assertThat(redelivered.attempt()).isEqualTo(1);
    }

    @Test
    @DisplayName("should dead-letter a job on its third failed delivery")
    void shouldDeadLetterAfterMaxDeliveries() {
      IngestionJob job = job("_Gare");
      queue.enqueue(job);

      queue.dequeue(Duration.ZERO);
      queue.requeue(job.jobId(), "Redis blip");
      queue.dequeue(Duration.ZERO);
      queue.requeue(job.jobId(), "Redis blip");
      queue.dequeue(Duration.ZERO);

      assertThatThrownBy(() -> queue.requeue(job.jobId(), "Redis blip"))
          .isInstanceOfSatisfying(
              QueueException.class,
              e -> assertThat(e.getKind()).isEqualTo(QueueException.Kind.REDELIVERY_EXHAUSTED));
      assertThat(queue.deadLetters(10))
          .singleElement()
          .satisfies(
              letter -> {
                assertThat(letter.job().attempt()).isEqualTo(3);
                assertThat(letter.reason()).isEqualTo("Redis blip");
              });
      assertThat(queue.stats()).isEqualTo(new QueueStats(0, 0, 1));
    }

    @Test
    @DisplayName("should dead-letter a leased job directly")
    void shouldDeadLetterDirectly() {
      IngestionJob job = job("_Gare");
      queue.enqueue(job);
      queue.dequeue(Duration.ZERO);

      queue.deadLetter(job.jobId(), "target missing");

      assertThat(queue.deadLetters(10)).extracting(DeadLetter::reason).containsExactly("target missing");
      assertThat(queue.stats().inFlight()).isZero();
    }

    @Test
    @DisplayName("should keep a job leased while its holder extends the lease")
    void shouldExtendLease() {
      IngestionJob job = job("_Gare");
      queue.enqueue(job);
      queue.dequeue(Duration.ZERO);

      clock.advance(Duration.ofMinutes(20));
      assertThat(queue.extendLease(job.jobId())).isTrue();
      clock.advance(Duration.ofMinutes(20));
      assertThat(queue.reclaimExpired()).isZero();

      clock.advance(Duration.ofMinutes(11));
      assertThat(queue.reclaimExpired()).isEqualTo(1);
      assertThat(queue.extendLease(job.jobId())).isFalse();
      assertThat(queue.stats()).isEqualTo(new QueueStats(1, 0, 0));
    }

    @Test
    @DisplayName("should ignore a requeue for a job that is not leased")
    void shouldIgnoreUnknownRequeue() {
      queue.requeue("missing", "whatever");

      assertThat(queue.stats()).isEqualTo(new QueueStats(0, 0, 0));
    }
  }

  private static final class MutableClock extends Clock {

    private Instant now;

    private MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
