package io.tradedesk.opsengine.attention;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Total order over findings: urgency descending, then oldest trigger first, then id. Duplicate ids
 * keep their highest-ranked finding.
 */
public final class AttentionRanker {

  public static final Comparator<AttentionFinding> ORDER =
      Comparator.comparingInt(AttentionFinding::urgency)
          .reversed()
          .thenComparing(AttentionFinding::triggeredAt)
          .thenComparing(AttentionFinding::id);

  private AttentionRanker() {}

  public static List<AttentionFinding> rank(List<AttentionFinding> findings, int cap) {
    var sorted = new ArrayList<>(findings);
    sorted.sort(ORDER);

    Map<String, AttentionFinding> unique = new LinkedHashMap<>();
    for (AttentionFinding finding : sorted) {
      unique.putIfAbsent(finding.id(), finding);
      if (unique.size() == cap) {
        break;
      }
    }
    return List.copyOf(unique.values());
  }
}
