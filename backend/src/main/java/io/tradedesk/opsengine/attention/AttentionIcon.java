package io.tradedesk.opsengine.attention;

import com.fasterxml.jackson.annotation.JsonValue;

/** UI icon keys an attention item may carry. */
public enum AttentionIcon {
  FILE_TEXT("file-text"),
  CLOCK("clock"),
  SHIELD("shield"),
  ALERT_CIRCLE("alert-circle"),
  BRIEFCASE("briefcase");

  private final String key;

  AttentionIcon(String key) {
    this.key = key;
  }

  @JsonValue
  public String key() {
    return key;
  }
}
