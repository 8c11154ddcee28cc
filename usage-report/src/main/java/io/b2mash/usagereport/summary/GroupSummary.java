package io.b2mash.usagereport.summary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Group-level figures for one report run.
 *
 * @param primaryCount members whose primary group is the reported group
 * @param secondaryCount supplementary members
 * @param unknownCount records with no resolved affiliation; excluded from {@link #totalMembers()}
 * @param tierCounts primary members holding each account tier, in tier table order
 * @param allocationGb the group's storage allocation
 * @param usedGb storage used by members
 * @param availableGb allocation minus used; negative when the group is over its allocation
 */
public record GroupSummary(
    int primaryCount,
    int secondaryCount,
    int unknownCount,
    Map<String, Integer> tierCounts,
    long allocationGb,
    long usedGb,
    long availableGb) {

  public GroupSummary {
    tierCounts = Collections.unmodifiableMap(new LinkedHashMap<>(tierCounts));
  }

  public int totalMembers() {
    return primaryCount + secondaryCount;
  }
}
