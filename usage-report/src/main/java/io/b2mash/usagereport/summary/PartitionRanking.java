package io.b2mash.usagereport.summary;

import java.util.List;

/** Job-count and CPU-hour rankings of primary members on one partition. */
public record PartitionRanking(
    String partition, List<RankedEntry> byJobs, List<RankedEntry> byCpuHours) {

  public PartitionRanking {
    byJobs = List.copyOf(byJobs);
    byCpuHours = List.copyOf(byCpuHours);
  }
}
