package io.tradedesk.opsengine.aggregation;

import java.util.concurrent.CompletableFuture;

/**
 * Typed ticket for a submitted source call. Redeemed against the {@link FanOutResult} of the same
 * fan-out once the join barrier has passed.
 *
 * @param <T> record type the source returns
 */
public final class SourceHandle<T> {

  private final String source;
  private final CompletableFuture<SourceOutcome<T>> outcome;

  SourceHandle(String source, CompletableFuture<SourceOutcome<T>> outcome) {
    this.source = source;
    this.outcome = outcome;
  }

  public String source() {
    return source;
  }

  CompletableFuture<SourceOutcome<T>> outcome() {
    return outcome;
  }
}
