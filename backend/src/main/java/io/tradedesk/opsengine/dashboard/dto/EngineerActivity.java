package io.tradedesk.opsengine.dashboard.dto;

import java.time.Instant;

/**
 * @param lastActive latest clocked time, null when the engineer never clocked any
 * @param todayJobCount jobs scheduled for the engineer today in the business time zone
 */
public record EngineerActivity(Instant lastActive, int todayJobCount) {}
