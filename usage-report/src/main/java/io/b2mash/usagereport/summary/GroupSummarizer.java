package io.b2mash.usagereport.summary;

import io.b2mash.usagereport.config.UsageReportProperties;
import io.b2mash.usagereport.dataset.UserRecord;
import io.b2mash.usagereport.membership.Affiliation;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derives group counts, storage totals and the top-N chart series from the merged records.
 *
 * <p>Tier counts and usage rankings consider primary members only; secondary members are shown in
 * the member table but are not charged against the group's premium tiers or usage. Storage
 * rankings consider every member with non-zero storage.
 */
@Component
public class GroupSummarizer {

  private static final Logger log = LoggerFactory.getLogger(GroupSummarizer.class);

  private final List<String> tierTags;
  private final int storageTopN;
  private final int usageTopN;

  public GroupSummarizer(UsageReportProperties properties) {
    this.tierTags = properties.accountTierTags();
    this.storageTopN = properties.storageTopN();
    this.usageTopN = properties.usageTopN();
  }

  public GroupSummary summarize(List<UserRecord> records, long allocationGb) {
    int primary = 0;
    int secondary = 0;
    int unknown = 0;
    long usedGb = 0;
    var tierCounts = new LinkedHashMap<String, Integer>();
    tierTags.forEach(tier -> tierCounts.put(tier, 0));

    for (var record : records) {
      usedGb += record.storageGb();
      switch (record.affiliation()) {
        case PRIMARY -> {
          primary++;
          for (String tier : record.accountTiers()) {
            tierCounts.merge(tier, 1, Integer::sum);
          }
        }
        case SECONDARY -> secondary++;
        default -> unknown++;
      }
    }

    if (unknown > 0) {
      log.warn("{} record(s) have no resolved affiliation", unknown);
    }
    log.debug(
        "Summary: primary={}, secondary={}, unknown={}, usedGb={}, allocationGb={}",
        primary,
        secondary,
        unknown,
        usedGb,
        allocationGb);

    return new GroupSummary(
        primary, secondary, unknown, tierCounts, allocationGb, usedGb, allocationGb - usedGb);
  }

  /** Largest storage consumers; members with no storage are left out entirely. */
  public List<RankedEntry> topStorageConsumers(List<UserRecord> records) {
    var pool = byUsername(records).stream().filter(r -> r.storageGb() > 0).toList();
    return TopNRanker.rank(pool, UserRecord::storageGb, UserRecord::username, storageTopN);
  }

  /** Largest consumers of one partition among primary members, zero usage included. */
  public List<RankedEntry> topUsageConsumers(
      List<UserRecord> records, String partition, UsageMetric metric) {
    var pool =
        byUsername(records).stream()
            .filter(r -> r.affiliation() == Affiliation.PRIMARY)
            .toList();
    return TopNRanker.rank(
        pool, r -> metric.of(r.usageOn(partition)), UserRecord::username, usageTopN);
  }

  /** Job and CPU-hour rankings for each partition, in the order given. */
  public List<PartitionRanking> rankPartitions(List<UserRecord> records, List<String> partitions) {
    return partitions.stream()
        .map(
            partition ->
                new PartitionRanking(
                    partition,
                    topUsageConsumers(records, partition, UsageMetric.JOBS),
                    topUsageConsumers(records, partition, UsageMetric.CPU_HOURS)))
        .toList();
  }

  private static List<UserRecord> byUsername(List<UserRecord> records) {
    return records.stream().sorted(Comparator.comparing(UserRecord::username)).toList();
  }
}
