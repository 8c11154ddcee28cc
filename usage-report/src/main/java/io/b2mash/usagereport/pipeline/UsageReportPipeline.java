package io.b2mash.usagereport.pipeline;

import io.b2mash.usagereport.config.UsageReportProperties;
import io.b2mash.usagereport.dataset.DatasetMerger;
import io.b2mash.usagereport.enrichment.UserEnrichmentService;
import io.b2mash.usagereport.enrichment.UserProfile;
import io.b2mash.usagereport.exception.ReportException;
import io.b2mash.usagereport.membership.MembershipResolver;
import io.b2mash.usagereport.pagination.ReportPaginator;
import io.b2mash.usagereport.storage.QuotaReportLoader;
import io.b2mash.usagereport.storage.QuotaSnapshot;
import io.b2mash.usagereport.summary.GroupSummarizer;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one report: resolve membership, then enrich every member and load the quota report
 * concurrently on the worker pool, wait for all of them, merge, summarize and paginate.
 *
 * <p>Nothing is merged until every task has finished. A failed quota load aborts the run; an
 * enrichment task that dies unexpectedly leaves its member without a profile, which the merger
 * reports as an internal consistency error.
 */
@Service
public class UsageReportPipeline {

  private static final Logger log = LoggerFactory.getLogger(UsageReportPipeline.class);

  private final MembershipResolver membershipResolver;
  private final UserEnrichmentService enrichmentService;
  private final QuotaReportLoader quotaReportLoader;
  private final DatasetMerger datasetMerger;
  private final GroupSummarizer summarizer;
  private final ReportPaginator paginator;
  private final ExecutorService workerPool;
  private final List<String> partitions;
  private final Clock clock;

  public UsageReportPipeline(
      MembershipResolver membershipResolver,
      UserEnrichmentService enrichmentService,
      QuotaReportLoader quotaReportLoader,
      DatasetMerger datasetMerger,
      GroupSummarizer summarizer,
      ReportPaginator paginator,
      @Qualifier("reportWorkerPool") ExecutorService workerPool,
      UsageReportProperties properties,
      Clock clock) {
    this.membershipResolver = membershipResolver;
    this.enrichmentService = enrichmentService;
    this.quotaReportLoader = quotaReportLoader;
    this.datasetMerger = datasetMerger;
    this.summarizer = summarizer;
    this.paginator = paginator;
    this.workerPool = workerPool;
    this.partitions = properties.partitions();
    this.clock = clock;
  }

  public UsageReport generate(ReportRequest request) {
    log.info(
        "Generating usage report for group {} from {} to {}",
        request.groupName(),
        request.start(),
        request.end());

    var affiliations = membershipResolver.resolve(request.groupName());

    CompletableFuture<QuotaSnapshot> quotaFuture =
        CompletableFuture.supplyAsync(
            () -> quotaReportLoader.load(request.quotaFile()), workerPool);

    var profileFutures = new HashMap<String, CompletableFuture<UserProfile>>();
    for (String username : affiliations.keySet()) {
      profileFutures.put(
          username,
          CompletableFuture.supplyAsync(
              () -> enrichmentService.enrich(username, request.start(), request.end()),
              workerPool));
    }

    var profiles = awaitProfiles(profileFutures);
    var quota = awaitQuota(quotaFuture);

    var records = datasetMerger.merge(affiliations, profiles, quota.storageByUser());
    var summary = summarizer.summarize(records, quota.allocationGb());
    var storageRanking = summarizer.topStorageConsumers(records);
    var usageRankings = summarizer.rankPartitions(records, partitions);
    var pages = paginator.paginate(records);

    log.info(
        "Report for {} ready: {} member(s), {} page(s), {} GB of {} GB used",
        request.groupName(),
        summary.totalMembers(),
        pages.size(),
        summary.usedGb(),
        summary.allocationGb());

    return new UsageReport(
        request,
        Instant.now(clock),
        partitions,
        records,
        summary,
        storageRanking,
        usageRankings,
        pages);
  }

  private Map<String, UserProfile> awaitProfiles(
      Map<String, CompletableFuture<UserProfile>> futures) {
    CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new))
        .exceptionally(ex -> null)
        .join();

    var profiles = new HashMap<String, UserProfile>();
    futures.forEach(
        (username, future) -> {
          try {
            profiles.put(username, future.join());
          } catch (CompletionException e) {
            log.error("Enrichment task for {} failed", username, e.getCause());
          }
        });
    return profiles;
  }

  private static QuotaSnapshot awaitQuota(CompletableFuture<QuotaSnapshot> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof ReportException reportException) {
        throw reportException;
      }
      throw e;
    }
  }
}
