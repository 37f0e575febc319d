package io.tradedesk.opsengine.dashboard.dto;

public record EnquirySummary(long openCount) {}
