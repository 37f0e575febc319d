package io.tradedesk.opsengine.dashboard.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Flags keyed by job id, in the order the jobs were listed. */
public record HealthFlagsResponse(boolean ok, Map<String, JobHealthFlags> flags) {

  public static HealthFlagsResponse of(LinkedHashMap<String, JobHealthFlags> flags) {
    return new HealthFlagsResponse(true, Collections.unmodifiableMap(flags));
  }
}
