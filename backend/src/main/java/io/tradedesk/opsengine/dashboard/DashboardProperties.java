package io.tradedesk.opsengine.dashboard;

import jakarta.validation.constraints.Max;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Dashboard view settings.
 *
 * @param zone business time zone deciding what "today" means for engineer workloads
 * @param flagsWindow jobs created within this window get health flags
 * @param flagsCap maximum jobs in the health flag map
 * @param pinCap maximum pins per source on the map
 * @param teamCap maximum engineers listed on the summary
 */
@Validated
@ConfigurationProperties(prefix = "ops.dashboard")
public record DashboardProperties(
    String zone,
    Duration flagsWindow,
    @Max(1000) int flagsCap,
    @Max(5000) int pinCap,
    @Max(100) int teamCap) {

  public DashboardProperties {
    zone = zone != null && !zone.isBlank() ? zone : "Europe/London";
    flagsWindow = flagsWindow != null ? flagsWindow : Duration.ofDays(90);
    flagsCap = flagsCap > 0 ? flagsCap : 200;
    pinCap = pinCap > 0 ? pinCap : 500;
    teamCap = teamCap > 0 ? teamCap : 10;
  }

  public static DashboardProperties defaults() {
    return new DashboardProperties(null, null, 0, 0, 0);
  }

  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }
}
