package io.tradedesk.opsengine.job;

import java.time.Instant;
import java.util.UUID;

/** Completed job with no live invoice. */
public record CompletedJobRecord(UUID id, String jobNumber, Instant completedAt) {}
