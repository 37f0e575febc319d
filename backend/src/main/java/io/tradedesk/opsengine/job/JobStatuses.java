package io.tradedesk.opsengine.job;

import java.util.Set;

/** Job status labels as stored by the job workflow. */
public final class JobStatuses {

  public static final String COMPLETED = "completed";
  public static final String CLOSED = "closed";
  public static final String CANCELLED = "cancelled";

  /** Statuses after which work on site is finished. */
  public static final Set<String> FINISHED = Set.of(COMPLETED, CLOSED);

  public static boolean isFinished(String status) {
    return status != null && FINISHED.contains(status);
  }

  private JobStatuses() {}
}
