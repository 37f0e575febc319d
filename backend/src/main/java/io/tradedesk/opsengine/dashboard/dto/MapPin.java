package io.tradedesk.opsengine.dashboard.dto;

import io.tradedesk.opsengine.display.SafeText;

public record MapPin(
    String id,
    MapPinType type,
    double lat,
    double lng,
    SafeText label,
    String href,
    String status) {}
