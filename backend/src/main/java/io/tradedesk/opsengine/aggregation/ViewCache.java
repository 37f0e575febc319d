package io.tradedesk.opsengine.aggregation;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived memoization of rendered view payloads. Not a correctness boundary: a miss simply
 * recomputes, and concurrent misses on the same key may each recompute and store.
 */
public interface ViewCache {

  /** Returns the payload stored under {@code key} if present, unexpired and of {@code type}. */
  <T> Optional<T> get(ViewKey key, Class<T> type);

  /** Stores {@code payload} under {@code key} for {@code ttl}. */
  void put(ViewKey key, Object payload, Duration ttl);
}
