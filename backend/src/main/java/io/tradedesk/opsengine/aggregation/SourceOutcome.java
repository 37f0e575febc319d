package io.tradedesk.opsengine.aggregation;

import java.util.List;

/**
 * Settled result of one source call: its rows, or an empty list when the call failed or timed
 * out.
 */
record SourceOutcome<T>(String source, List<T> records, boolean failed) {

  static <T> SourceOutcome<T> ok(String source, List<T> records) {
    return new SourceOutcome<>(source, records != null ? List.copyOf(records) : List.of(), false);
  }

  static <T> SourceOutcome<T> failed(String source) {
    return new SourceOutcome<>(source, List.of(), true);
  }
}
