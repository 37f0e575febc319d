package io.tradedesk.opsengine.timesheet;

import java.util.UUID;

public record EngineerRecord(UUID id, String name) {}
