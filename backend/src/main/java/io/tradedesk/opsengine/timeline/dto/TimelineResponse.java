package io.tradedesk.opsengine.timeline.dto;

import io.tradedesk.opsengine.timeline.ActivityItem;
import java.util.List;

public record TimelineResponse(boolean ok, List<ActivityItem> items) {

  public static TimelineResponse of(List<ActivityItem> items) {
    return new TimelineResponse(true, List.copyOf(items));
  }
}
