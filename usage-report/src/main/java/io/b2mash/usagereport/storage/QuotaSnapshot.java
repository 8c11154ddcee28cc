package io.b2mash.usagereport.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Storage figures read from a quota report.
 *
 * @param totalUsedGb storage used by the whole group, from the aggregate row
 * @param totalAvailableGb storage still available to the group, from the aggregate row
 * @param storageByUser whole gigabytes used per username; the aggregate row is not included
 */
public record QuotaSnapshot(
    long totalUsedGb, long totalAvailableGb, Map<String, Long> storageByUser) {

  public QuotaSnapshot {
    storageByUser = Collections.unmodifiableMap(new LinkedHashMap<>(storageByUser));
  }

  /** The group's allocation ceiling: what is used plus what remains. */
  public long allocationGb() {
    return totalUsedGb + totalAvailableGb;
  }
}
