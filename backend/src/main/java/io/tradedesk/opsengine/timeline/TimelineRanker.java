package io.tradedesk.opsengine.timeline;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Newest fact first; equal timestamps fall back to id so the order is total. */
public final class TimelineRanker {

  public static final Comparator<ActivityItem> NEWEST_FIRST =
      Comparator.comparing(ActivityItem::timestamp)
          .reversed()
          .thenComparing(ActivityItem::id);

  private TimelineRanker() {}

  public static List<ActivityItem> newestFirst(List<ActivityItem> items, int cap) {
    var sorted = new ArrayList<>(items);
    sorted.sort(NEWEST_FIRST);

    Map<String, ActivityItem> unique = new LinkedHashMap<>();
    for (ActivityItem item : sorted) {
      unique.putIfAbsent(item.id(), item);
      if (unique.size() == cap) {
        break;
      }
    }
    return List.copyOf(unique.values());
  }
}
