package io.tradedesk.opsengine.aggregation;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Serves a view from the {@link ViewCache} or computes it. Only complete results are stored; a
 * partial result is returned to the caller and recomputed on the next request.
 */
@Component
public class ViewRenderer {

  private static final Logger log = LoggerFactory.getLogger(ViewRenderer.class);

  private final ViewCache viewCache;
  private final ViewCacheProperties cacheProperties;

  public ViewRenderer(ViewCache viewCache, ViewCacheProperties cacheProperties) {
    this.viewCache = viewCache;
    this.cacheProperties = cacheProperties;
  }

  public <T> T render(ViewKey key, Class<T> type, Supplier<Rendered<T>> compute) {
    long startedAt = System.nanoTime();
    Optional<T> cached = viewCache.get(key, type);
    if (cached.isPresent()) {
      logPerf(key, startedAt, true, false);
      return cached.get();
    }

    Rendered<T> rendered = compute.get();
    if (!rendered.partial()) {
      viewCache.put(key, rendered.payload(), cacheProperties.ttl());
    }
    logPerf(key, startedAt, false, rendered.partial());
    return rendered.payload();
  }

  private void logPerf(ViewKey key, long startedAt, boolean cacheHit, boolean partial) {
    log.info(
        "View served: view={}, tenant={}, ms={}, cacheHit={}, partial={}",
        key.view(),
        key.tenantId(),
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt),
        cacheHit,
        partial);
  }
}
