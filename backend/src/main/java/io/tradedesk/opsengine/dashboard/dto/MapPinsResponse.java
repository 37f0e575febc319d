package io.tradedesk.opsengine.dashboard.dto;

import java.util.List;

public record MapPinsResponse(boolean ok, List<MapPin> pins) {

  public static MapPinsResponse of(List<MapPin> pins) {
    return new MapPinsResponse(true, List.copyOf(pins));
  }
}
