package io.b2mash.usagereport.summary;

import io.b2mash.usagereport.dataset.PartitionUsage;

/** Partition usage figures that can be ranked. */
public enum UsageMetric {
  JOBS("Jobs") {
    @Override
    public double of(PartitionUsage usage) {
      return usage.jobCount();
    }
  },
  CPU_HOURS("CPU Hours") {
    @Override
    public double of(PartitionUsage usage) {
      return usage.cpuHours();
    }
  };

  private final String label;

  UsageMetric(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public abstract double of(PartitionUsage usage);
}
