package io.tradedesk.opsengine.aggregation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;

/** In-process {@link ViewCache} backed by Caffeine with a per-entry TTL. */
public final class CaffeineViewCache implements ViewCache {

  private final Cache<ViewKey, CacheEntry> cache;

  public CaffeineViewCache(long maximumSize) {
    this(maximumSize, Ticker.systemTicker());
  }

  CaffeineViewCache(long maximumSize, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new EntryTtlExpiry())
            .ticker(ticker)
            .build();
  }

  @Override
  public <T> Optional<T> get(ViewKey key, Class<T> type) {
    CacheEntry entry = cache.getIfPresent(key);
    if (entry == null || !type.isInstance(entry.payload())) {
      return Optional.empty();
    }
    return Optional.of(type.cast(entry.payload()));
  }

  @Override
  public void put(ViewKey key, Object payload, Duration ttl) {
    if (ttl.isZero() || ttl.isNegative()) {
      return;
    }
    cache.put(key, new CacheEntry(payload, ttl));
  }

  long estimatedSize() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private record CacheEntry(Object payload, Duration ttl) {}

  private static final class EntryTtlExpiry implements Expiry<ViewKey, CacheEntry> {

    @Override
    public long expireAfterCreate(ViewKey key, CacheEntry value, long currentTime) {
      return value.ttl().toNanos();
    }

    @Override
    public long expireAfterUpdate(
        ViewKey key, CacheEntry value, long currentTime, long currentDuration) {
      return value.ttl().toNanos();
    }

    @Override
    public long expireAfterRead(
        ViewKey key, CacheEntry value, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
