package io.tradedesk.opsengine.job;

/** Live jobs in one workflow status. */
public record JobStatusCount(String status, long count) {}
