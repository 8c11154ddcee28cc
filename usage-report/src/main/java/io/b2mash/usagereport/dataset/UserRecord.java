package io.b2mash.usagereport.dataset;

import io.b2mash.usagereport.membership.Affiliation;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the report knows about one group member. Built once by {@link DatasetMerger}; every
 * field is populated, with defaults standing in for data a source could not supply.
 */
public record UserRecord(
    String username,
    Affiliation affiliation,
    String name,
    String email,
    List<String> accountTiers,
    Map<String, PartitionUsage> usageByPartition,
    long storageGb) {

  public UserRecord {
    if (username == null || username.isBlank()) {
      throw new IllegalArgumentException("username must not be empty");
    }
    if (storageGb < 0) {
      throw new IllegalArgumentException("storageGb must be non-negative for " + username);
    }
    accountTiers = List.copyOf(accountTiers);
    usageByPartition = Collections.unmodifiableMap(new LinkedHashMap<>(usageByPartition));
  }

  public PartitionUsage usageOn(String partition) {
    return usageByPartition.getOrDefault(partition, PartitionUsage.ZERO);
  }
}
