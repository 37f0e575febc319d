package io.tradedesk.opsengine.job;

import java.time.Instant;
import java.util.UUID;

/** A completed job with its count of open snag items. */
public record SnaggedJobRecord(UUID jobId, String jobNumber, Instant jobCompletedAt, long openSnags) {}
