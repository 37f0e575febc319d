package io.tradedesk.opsengine.aggregation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ViewCacheConfig {

  private static final Logger log = LoggerFactory.getLogger(ViewCacheConfig.class);

  @Bean
  ViewCache viewCache(ViewCacheProperties properties) {
    if (!properties.isEnabled()) {
      log.info("View cache disabled; every request recomputes");
      return new NoOpViewCache();
    }
    log.info(
        "View cache enabled: ttl={}, maximumSize={}", properties.ttl(), properties.maximumSize());
    return new CaffeineViewCache(properties.maximumSize());
  }
}
