package io.tradedesk.opsengine.dashboard.dto;

import java.util.UUID;

public record TeamMember(UUID id, String name) {}
