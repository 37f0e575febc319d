package io.tradedesk.opsengine.dashboard.dto;

public record JobHealthFlags(boolean hasInvoice, boolean hasOpenSnags, boolean hasMissingTimesheet) {}
