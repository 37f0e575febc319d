package io.tradedesk.opsengine.timeline;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Timeline caps.
 *
 * @param entityCap facts returned for one job or client
 * @param portalCap facts returned by the client portal feed
 * @param activityCap facts returned by the dashboard activity feed
 * @param activityRowsPerSource rows read from each non-audit source for the activity feed
 */
@ConfigurationProperties(prefix = "ops.timeline")
public record TimelineProperties(
    int entityCap, int portalCap, int activityCap, int activityRowsPerSource) {

  public TimelineProperties {
    entityCap = entityCap > 0 ? entityCap : 3;
    portalCap = portalCap > 0 ? portalCap : 100;
    activityCap = activityCap > 0 ? activityCap : 10;
    activityRowsPerSource = activityRowsPerSource > 0 ? activityRowsPerSource : 5;
  }

  public static TimelineProperties defaults() {
    return new TimelineProperties(0, 0, 0, 0);
  }
}
