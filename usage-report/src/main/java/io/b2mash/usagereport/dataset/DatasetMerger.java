package io.b2mash.usagereport.dataset;

import io.b2mash.usagereport.config.UsageReportProperties;
import io.b2mash.usagereport.enrichment.UserProfile;
import io.b2mash.usagereport.exception.MembershipEnrichmentMismatchException;
import io.b2mash.usagereport.membership.Affiliation;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Joins membership, enrichment and storage on username into one {@link UserRecord} per member.
 *
 * <p>Membership decides who is in the group. Enrichment must exist for every member; a gap is an
 * internal error, not something to paper over. Storage defaults to zero. Enrichment or storage
 * rows for usernames outside the membership are stale and dropped.
 */
@Component
public class DatasetMerger {

  private static final Logger log = LoggerFactory.getLogger(DatasetMerger.class);

  private final List<String> partitions;

  public DatasetMerger(UsageReportProperties properties) {
    this.partitions = properties.partitions();
  }

  public List<UserRecord> merge(
      Map<String, Affiliation> affiliations,
      Map<String, UserProfile> profiles,
      Map<String, Long> storageByUser) {
    var missing = new HashSet<>(affiliations.keySet());
    missing.removeAll(profiles.keySet());
    if (!missing.isEmpty()) {
      throw new MembershipEnrichmentMismatchException(missing);
    }

    var records = new ArrayList<UserRecord>(affiliations.size());
    for (String username : new TreeSet<>(affiliations.keySet())) {
      var profile = profiles.get(username);
      long storageGb = Math.max(0L, storageByUser.getOrDefault(username, 0L));
      records.add(
          new UserRecord(
              username,
              affiliations.get(username),
              profile.name(),
              profile.email(),
              profile.accountTiers(),
              completeUsage(profile.usageByPartition()),
              storageGb));
    }

    logDroppedRows("enrichment", profiles.keySet(), affiliations);
    logDroppedRows("storage", storageByUser.keySet(), affiliations);
    return records;
  }

  private Map<String, PartitionUsage> completeUsage(Map<String, PartitionUsage> usage) {
    var complete = new LinkedHashMap<String, PartitionUsage>();
    for (String partition : partitions) {
      complete.put(partition, usage.getOrDefault(partition, PartitionUsage.ZERO));
    }
    return complete;
  }

  private static void logDroppedRows(
      String source, Iterable<String> usernames, Map<String, Affiliation> affiliations) {
    var dropped = new TreeSet<String>();
    for (String username : usernames) {
      if (!affiliations.containsKey(username)) {
        dropped.add(username);
      }
    }
    if (!dropped.isEmpty()) {
      log.info("Dropped {} {} row(s) for users outside the group", dropped.size(), source);
      log.debug("Dropped {} rows: {}", source, dropped);
    }
  }
}
