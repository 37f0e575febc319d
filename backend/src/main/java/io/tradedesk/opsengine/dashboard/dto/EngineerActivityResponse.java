package io.tradedesk.opsengine.dashboard.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record EngineerActivityResponse(boolean ok, Map<String, EngineerActivity> activity) {

  public static EngineerActivityResponse of(LinkedHashMap<String, EngineerActivity> activity) {
    return new EngineerActivityResponse(true, Collections.unmodifiableMap(activity));
  }
}
