package io.b2mash.usagereport.enrichment;

import io.b2mash.usagereport.dataset.PartitionUsage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Per-user facts gathered from the identity directory and the accounting subsystem. */
public record UserProfile(
    String username,
    String name,
    String email,
    List<String> accountTiers,
    Map<String, PartitionUsage> usageByPartition) {

  public UserProfile {
    accountTiers = List.copyOf(accountTiers);
    usageByPartition = Collections.unmodifiableMap(new LinkedHashMap<>(usageByPartition));
  }
}
