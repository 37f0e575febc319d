package io.tradedesk.opsengine.aggregation;

/** A freshly computed view payload and whether any of its sources failed. */
public record Rendered<T>(T payload, boolean partial) {

  public static <T> Rendered<T> of(T payload, FanOutResult fanOut) {
    return new Rendered<>(payload, fanOut.isPartial());
  }
}
