package io.tradedesk.opsengine.job;

import java.util.UUID;

public record JobPinRecord(
    UUID id, String jobNumber, String title, String status, Double latitude, Double longitude) {}
