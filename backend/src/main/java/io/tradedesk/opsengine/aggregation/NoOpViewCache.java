package io.tradedesk.opsengine.aggregation;

import java.time.Duration;
import java.util.Optional;

/** Cache that never stores; every lookup recomputes. */
public final class NoOpViewCache implements ViewCache {

  @Override
  public <T> Optional<T> get(ViewKey key, Class<T> type) {
    return Optional.empty();
  }

  @Override
  public void put(ViewKey key, Object payload, Duration ttl) {}
}
