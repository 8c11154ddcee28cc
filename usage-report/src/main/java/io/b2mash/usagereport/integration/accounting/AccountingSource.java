package io.b2mash.usagereport.integration.accounting;

import java.time.LocalDate;
import java.util.List;

/**
 * Port to the cluster's job accounting subsystem. Swappable so the aggregation pipeline can run
 * against deterministic fixtures.
 */
public interface AccountingSource {

  /**
   * Returns the cumulative CPU time, in core-seconds, of each job the user ran on the partition
   * within the window. Job steps are not reported separately. An empty list means no usage.
   */
  List<Long> completedJobCpuSeconds(
      String username, String partition, LocalDate start, LocalDate end)
      throws AccountingQueryException;
}
