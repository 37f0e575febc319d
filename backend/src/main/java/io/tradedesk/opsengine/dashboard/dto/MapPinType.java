package io.tradedesk.opsengine.dashboard.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MapPinType {
  JOB("job"),
  QUOTE("quote");

  private final String key;

  MapPinType(String key) {
    this.key = key;
  }

  @JsonValue
  public String key() {
    return key;
  }
}
