package com.flamingo.ai.kbsearch.service.queue;

public record QueueStats(long pending, long inFlight, long deadLettered) {}
