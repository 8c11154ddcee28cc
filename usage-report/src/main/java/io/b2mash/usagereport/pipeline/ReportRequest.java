package io.b2mash.usagereport.pipeline;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * Parameters of one report run.
 *
 * @param groupName the group being reported on
 * @param start first day of the accounting window
 * @param end last day of the accounting window, passed to the accounting query as given
 * @param quotaFile the quota report to read
 */
public record ReportRequest(String groupName, LocalDate start, LocalDate end, Path quotaFile) {

  public ReportRequest {
    if (groupName == null || groupName.isBlank()) {
      throw new IllegalArgumentException("groupName must not be empty");
    }
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("start " + start + " is after end " + end);
    }
  }
}
