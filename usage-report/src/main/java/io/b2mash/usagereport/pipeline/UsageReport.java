package io.b2mash.usagereport.pipeline;

import io.b2mash.usagereport.dataset.UserRecord;
import io.b2mash.usagereport.pagination.ReportPage;
import io.b2mash.usagereport.summary.GroupSummary;
import io.b2mash.usagereport.summary.PartitionRanking;
import io.b2mash.usagereport.summary.RankedEntry;
import java.time.Instant;
import java.util.List;

/** Read-only result of one pipeline run, handed to rendering as is. */
public record UsageReport(
    ReportRequest request,
    Instant generatedAt,
    List<String> partitions,
    List<UserRecord> records,
    GroupSummary summary,
    List<RankedEntry> storageRanking,
    List<PartitionRanking> usageRankings,
    List<ReportPage> pages) {

  public UsageReport {
    partitions = List.copyOf(partitions);
    records = List.copyOf(records);
    storageRanking = List.copyOf(storageRanking);
    usageRankings = List.copyOf(usageRankings);
    pages = List.copyOf(pages);
  }
}
