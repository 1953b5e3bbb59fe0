package com.flamingo.ai.kbsearch.service.ingestion;

import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs a unit of work in its own transaction, retrying on SQLite lock contention. Each attempt is
 * a fresh transaction, so a state transition commits independently of the caller.
 */
@Component
@Slf4j
public class RetryingTransactions {

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private final TransactionTemplate transactionTemplate;

  public RetryingTransactions(PlatformTransactionManager transactionManager) {
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.transactionTemplate.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  public <T> T execute(String description, Supplier<T> work) {
    for (int attempt = 1; ; attempt++) {
      try {
        return transactionTemplate.execute(status -> work.get());
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to {} after {} retries", description, MAX_RETRIES);
          throw e;
        }
        log.warn("SQLite lock contention on {}, retry {}/{}", description, attempt, MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted during retry", ie);
        }
      }
    }
  }

  public void run(String description, Runnable work) {
    execute(
        description,
        () -> {
          work.run();
          return null;
        });
  }
}
