package io.tradedesk.opsengine.aggregation;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * View cache settings. The TTL bounds how stale a dashboard payload may be; entries are never
 * invalidated by writes elsewhere.
 */
@ConfigurationProperties(prefix = "ops.cache")
public record ViewCacheProperties(Boolean enabled, Duration ttl, long maximumSize) {

  public ViewCacheProperties {
    enabled = enabled != null ? enabled : Boolean.TRUE;
    ttl = ttl != null ? ttl : Duration.ofSeconds(30);
    maximumSize = maximumSize > 0 ? maximumSize : 10_000;
  }

  public boolean isEnabled() {
    return enabled;
  }
}
