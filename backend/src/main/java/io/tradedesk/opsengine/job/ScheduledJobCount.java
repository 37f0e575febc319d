package io.tradedesk.opsengine.job;

import java.util.UUID;

/** Jobs scheduled for one engineer inside a time range. */
public record ScheduledJobCount(UUID engineerId, long jobCount) {}
