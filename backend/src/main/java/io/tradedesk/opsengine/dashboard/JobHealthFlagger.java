package io.tradedesk.opsengine.dashboard;

import io.tradedesk.opsengine.dashboard.dto.JobHealthFlags;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Pure flag assignment for the jobs list. Every listed job gets all three flags; a job missing from
 * a lookup set is simply not flagged for it.
 */
public final class JobHealthFlagger {

  private JobHealthFlagger() {}

  public static LinkedHashMap<String, JobHealthFlags> flag(
      List<UUID> jobIds,
      List<UUID> invoicedJobIds,
      List<UUID> jobIdsWithOpenSnags,
      List<UUID> jobIdsWithUnsubmittedTime) {
    Set<UUID> invoiced = new HashSet<>(invoicedJobIds);
    Set<UUID> snagged = new HashSet<>(jobIdsWithOpenSnags);
    Set<UUID> unsubmitted = new HashSet<>(jobIdsWithUnsubmittedTime);

    var flags = new LinkedHashMap<String, JobHealthFlags>();
    for (UUID jobId : jobIds) {
      flags.putIfAbsent(
          jobId.toString(),
          new JobHealthFlags(
              invoiced.contains(jobId), snagged.contains(jobId), unsubmitted.contains(jobId)));
    }
    return flags;
  }
}
