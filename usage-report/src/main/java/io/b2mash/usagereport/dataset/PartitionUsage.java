package io.b2mash.usagereport.dataset;

import java.util.List;

/**
 * Job count and CPU time of one user on one partition. CPU time is held in core-hours everywhere
 * in the pipeline; conversion from the accounting system's core-seconds happens only in {@link
 * #fromCpuSeconds}.
 */
public record PartitionUsage(long jobCount, double cpuHours) {

  public static final PartitionUsage ZERO = new PartitionUsage(0, 0.0);

  private static final double SECONDS_PER_HOUR = 3600.0;

  public PartitionUsage {
    if (jobCount < 0 || cpuHours < 0 || Double.isNaN(cpuHours)) {
      throw new IllegalArgumentException(
          "Partition usage must be non-negative: jobs=" + jobCount + ", cpuHours=" + cpuHours);
    }
  }

  public static PartitionUsage fromCpuSeconds(List<Long> perJobCpuSeconds) {
    if (perJobCpuSeconds.isEmpty()) {
      return ZERO;
    }
    long totalSeconds = perJobCpuSeconds.stream().mapToLong(Long::longValue).sum();
    return new PartitionUsage(perJobCpuSeconds.size(), totalSeconds / SECONDS_PER_HOUR);
  }
}
