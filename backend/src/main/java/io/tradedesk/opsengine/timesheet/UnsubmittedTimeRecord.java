package io.tradedesk.opsengine.timesheet;

import java.time.Instant;
import java.util.UUID;

/** Time entry not covered by a submitted or approved timesheet, with its engineer's name. */
public record UnsubmittedTimeRecord(
    UUID entryId, UUID engineerId, String engineerName, String engineerEmail, Instant startedAt) {}
