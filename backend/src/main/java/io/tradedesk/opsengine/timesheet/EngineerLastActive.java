package io.tradedesk.opsengine.timesheet;

import java.time.Instant;
import java.util.UUID;

/** Latest clocked activity of one engineer. */
public record EngineerLastActive(UUID engineerId, Instant lastActive) {}
