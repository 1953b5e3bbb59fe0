package com.flamingo.ai.kbsearch.service.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.domain.enums.IngestionMode;
import com.flamingo.ai.kbsearch.exception.QueueException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.RedisScript;

@ExtendWith(MockitoExtension.class)
class RedisJobQueueTest {

  private static final String PENDING = "kbsearch:jobs:pending";
  private static final String PROCESSING = "kbsearch:jobs:processing";
  private static final String PAYLOADS = "kbsearch:jobs:payloads";
  private static final String DLQ = "kbsearch:jobs:dlq";

  @Mock private StringRedisTemplate redis;
  @Mock private ListOperations<String, String> listOps;
  @Mock private HashOperations<String, Object, Object> hashOps;
  @Mock private ZSetOperations<String, String> zSetOps;

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);

  private RedisJobQueue queue;

  @BeforeEach
  void setUp() {
    lenient().when(redis.opsForList()).thenReturn(listOps);
    lenient().when(redis.<Object, Object>opsForHash()).thenReturn(hashOps);
    lenient().when(redis.opsForZSet()).thenReturn(zSetOps);
    queue = new RedisJobQueue(redis, objectMapper, new IngestionConfig().getQueue(), clock);
  }

  private IngestionJob job(int attempt) {
    return new IngestionJob(
        "job-1",
        IngestionMode.FULL,
        "sentence-transformer",
        "_Gare",
        attempt,
        Instant.parse("2026-03-02T08:00:00Z"));
  }

  private void storePayload(IngestionJob job) throws Exception {
    lenient()
        .when(hashOps.get(PAYLOADS, job.jobId()))
        .thenReturn(objectMapper.writeValueAsString(job));
  }

  @Test
  @DisplayName("should store the payload and push the job ID")
  void shouldEnqueue() throws Exception {
    queue.enqueue(job(0));

    ArgumentCaptor<Object> json = ArgumentCaptor.forClass(Object.class);
    verify(hashOps).put(eq(PAYLOADS), eq("job-1"), json.capture());
    assertThat(objectMapper.readValue(json.getValue().toString(), IngestionJob.class))
        .isEqualTo(job(0));
    verify(listOps).leftPush(PENDING, "job-1");
  }

  @Test
  @DisplayName("should lease a dequeued job until the visibility deadline")
  void shouldLeaseOnDequeue() throws Exception {
    when(listOps.rightPop(PENDING, 5000L, TimeUnit.MILLISECONDS)).thenReturn("job-1");
    storePayload(job(0));

    assertThat(queue.dequeue(Duration.ofSeconds(5))).contains(job(0));

    double deadline = clock.millis() + Duration.ofMinutes(30).toMillis();
    verify(zSetOps).add(PROCESSING, "job-1", deadline);
  }

  @Test
  @DisplayName("should move the deadline of a job that is still leased")
  void shouldExtendLease() {
    String deadline = Long.toString(clock.millis() + Duration.ofMinutes(30).toMillis());
    when(redis.execute(
            ArgumentMatchers.<RedisScript<Long>>any(),
            eq(List.of(PROCESSING)),
            eq(deadline),
            eq("job-1")))
        .thenReturn(1L);

    assertThat(queue.extendLease("job-1")).isTrue();
  }

  @Test
  @DisplayName("should not recreate the lease of a reclaimed job")
  void shouldNotExtendReclaimedLease() {
    when(redis.execute(
            ArgumentMatchers.<RedisScript<Long>>any(),
            eq(List.of(PROCESSING)),
            anyString(),
            eq("job-1")))
        .thenReturn(0L);

    assertThat(queue.extendLease("job-1")).isFalse();
    verify(zSetOps, never()).add(anyString(), anyString(), anyDouble());
  }

  @Test
  @DisplayName("should drop a job whose payload is gone")
  void shouldDropJobWithoutPayload() {
    when(listOps.rightPop(PENDING, 5000L, TimeUnit.MILLISECONDS)).thenReturn("job-1");

    assertThat(queue.dequeue(Duration.ofSeconds(5))).isEmpty();
    verify(zSetOps).remove(PROCESSING, "job-1");
  }

  @Test
  @DisplayName("should requeue with the attempt incremented")
  void shouldRequeue() throws Exception {
    storePayload(job(0));

    queue.requeue("job-1", "transient failure");

    ArgumentCaptor<Object> json = ArgumentCaptor.forClass(Object.class);
    verify(hashOps).put(eq(PAYLOADS), eq("job-1"), json.capture());
    assertThat(objectMapper.readValue(json.getValue().toString(), IngestionJob.class).attempt())
        .isEqualTo(1);
    verify(listOps).leftPush(PENDING, "job-1");
  }

  @Test
  @DisplayName("should dead-letter when the deliveries are exhausted")
  void shouldDeadLetterExhaustedJob() throws Exception {
    storePayload(job(2));

    assertThatThrownBy(() -> queue.requeue("job-1", "transient failure"))
        .isInstanceOfSatisfying(
            QueueException.class,
            e -> assertThat(e.getKind()).isEqualTo(QueueException.Kind.REDELIVERY_EXHAUSTED));

    ArgumentCaptor<String> letter = ArgumentCaptor.forClass(String.class);
    verify(listOps).leftPush(eq(DLQ), letter.capture());
    assertThat(objectMapper.readValue(letter.getValue(), DeadLetter.class).job().attempt())
        .isEqualTo(3);
    verify(redis).expire(DLQ, Duration.ofDays(7));
    verify(hashOps).delete(PAYLOADS, "job-1");
    verify(listOps, never()).leftPush(PENDING, "job-1");
  }

  @Test
  @DisplayName("should reclaim only the leases it removes itself")
  void shouldReclaimExpiredLeases() throws Exception {
    when(zSetOps.rangeByScore(PROCESSING, 0, clock.millis())).thenReturn(Set.of("job-1", "job-2"));
    when(zSetOps.remove(PROCESSING, "job-1")).thenReturn(1L);
    when(zSetOps.remove(PROCESSING, "job-2")).thenReturn(0L);
    storePayload(job(0));

    assertThat(queue.reclaimExpired()).isEqualTo(1);
    verify(listOps).leftPush(PENDING, "job-1");
    verify(listOps, never()).leftPush(PENDING, "job-2");
  }

  @Test
  @DisplayName("should report an unreachable Redis as unavailable")
  void shouldReportUnavailable() {
    when(listOps.leftPush(anyString(), anyString()))
        .thenThrow(new RedisConnectionFailureException("Connection refused"));

    assertThatThrownBy(() -> queue.enqueue(job(0)))
        .isInstanceOfSatisfying(
            QueueException.class,
            e -> assertThat(e.getKind()).isEqualTo(QueueException.Kind.UNAVAILABLE));
  }

  @Test
  @DisplayName("should report sizes with missing keys as zero")
  void shouldReportStats() {
    when(listOps.size(PENDING)).thenReturn(4L);
    when(zSetOps.zCard(PROCESSING)).thenReturn(null);
    when(listOps.size(DLQ)).thenReturn(1L);

    assertThat(queue.stats()).isEqualTo(new QueueStats(4, 0, 1));
  }
}
