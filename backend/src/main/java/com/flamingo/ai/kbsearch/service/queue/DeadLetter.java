package com.flamingo.ai.kbsearch.service.queue;

import java.time.Instant;

/** A job that exhausted its deliveries or failed permanently. */
public record DeadLetter(IngestionJob job, String reason, Instant deadLetteredAt) {}
