package io.tradedesk.opsengine.attention.dto;

import io.tradedesk.opsengine.attention.AttentionItem;
import java.util.List;

public record AttentionResponse(boolean ok, List<AttentionItem> items) {

  public static AttentionResponse of(List<AttentionItem> items) {
    return new AttentionResponse(true, List.copyOf(items));
  }
}
