package io.tradedesk.opsengine.aggregation;

import jakarta.validation.constraints.Max;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings shared by every source adapter call made through {@link SourceFanOut}.
 *
 * @param timeout per-source deadline; a source that misses it is treated as failed
 * @param rowCap maximum rows a listing source may return
 * @param countingRowCap maximum rows for sources whose rows are grouped after loading (time
 *     entries, engineers, paid invoices)
 * @param poolSize worker threads available to the fan-out executor
 * @param queueCapacity pending source calls the executor buffers before rejecting
 */
@Validated
@ConfigurationProperties(prefix = "ops.sources")
public record SourceProperties(
    Duration timeout,
    @Max(1000) int rowCap,
    @Max(10_000) int countingRowCap,
    @Max(256) int poolSize,
    int queueCapacity) {

  public SourceProperties {
    timeout = timeout != null ? timeout : Duration.ofMillis(800);
    rowCap = rowCap > 0 ? rowCap : 50;
    countingRowCap = countingRowCap > 0 ? countingRowCap : 500;
    poolSize = poolSize > 0 ? poolSize : 16;
    queueCapacity = queueCapacity > 0 ? queueCapacity : 500;
  }

  public static SourceProperties defaults() {
    return new SourceProperties(null, 0, 0, 0, 0);
  }
}
