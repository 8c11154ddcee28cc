package io.b2mash.usagereport.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for report generation, bound from {@code usage-report.*}.
 *
 * @param partitions partitions queried for every member, in display order
 * @param accountTiers premium tier table; each tier lists the directory groups that grant it
 * @param storageTopN number of named bars in the storage chart
 * @param usageTopN number of named bars in each usage chart
 * @param pagination member table paging
 * @param quota quota report location and layout
 * @param accounting accounting command settings
 * @param directory identity directory command settings
 * @param commandTimeout upper bound for a single external command
 * @param workerThreads size of the enrichment worker pool
 * @param outputDir directory the report is written to when no explicit output is given
 */
@ConfigurationProperties(prefix = "usage-report")
public record UsageReportProperties(
    @DefaultValue({"batch", "bigmem", "gpu"}) List<String> partitions,
    List<AccountTierDefinition> accountTiers,
    @DefaultValue("5") int storageTopN,
    @DefaultValue("10") int usageTopN,
    @DefaultValue Pagination pagination,
    @DefaultValue Quota quota,
    @DefaultValue Accounting accounting,
    @DefaultValue Directory directory,
    @DefaultValue("60s") Duration commandTimeout,
    @DefaultValue("8") int workerThreads,
    @DefaultValue(".") Path outputDir) {

  public static final List<AccountTierDefinition> DEFAULT_ACCOUNT_TIERS =
      List.of(
          new AccountTierDefinition(
              "priority",
              List.of(
                  "priority", "priority1", "priority2", "priority3", "priority4", "priority5",
                  "priority6", "priority7", "priority8", "priority9")),
          new AccountTierDefinition("priority+", List.of("priority+", "priority+1")),
          new AccountTierDefinition("pri-gpu", List.of("pri-gpu", "pri-gpu1")),
          new AccountTierDefinition("pri-gpu+", List.of("pri-gpu+", "pri-gpu+1")),
          new AccountTierDefinition("gpu-he", List.of("gpu-he", "gpu-he1")));

  public UsageReportProperties {
    partitions = partitions == null ? List.of() : List.copyOf(partitions);
    accountTiers =
        accountTiers == null || accountTiers.isEmpty()
            ? DEFAULT_ACCOUNT_TIERS
            : List.copyOf(accountTiers);
    if (storageTopN < 1 || usageTopN < 1) {
      throw new IllegalArgumentException("Top-N sizes must be at least 1");
    }
    if (workerThreads < 1) {
      throw new IllegalArgumentException("usage-report.worker-threads must be at least 1");
    }
  }

  /** Tier tags in table order. */
  public List<String> accountTierTags() {
    return accountTiers.stream().map(AccountTierDefinition::tag).toList();
  }

  public record AccountTierDefinition(String tag, List<String> groups) {
    public AccountTierDefinition {
      groups = groups == null ? List.of() : List.copyOf(groups);
    }
  }

  /**
   * @param pageSize rows per page, section headers included
   * @param keepHeaderWithRows move a section header that would end a page onto the next page
   */
  public record Pagination(
      @DefaultValue("25") int pageSize, @DefaultValue("false") boolean keepHeaderWithRows) {
    public Pagination {
      if (pageSize < 1) {
        throw new IllegalArgumentException("usage-report.pagination.page-size must be at least 1");
      }
    }
  }

  /**
   * @param pathPattern quota report location, {@code {group}} is replaced by the group name
   * @param headerLines leading lines to skip before the group aggregate row
   */
  public record Quota(
      @DefaultValue("/gpfs/data/ccvstaff/quota-reports/{group}-quota-report.txt")
          String pathPattern,
      @DefaultValue("2") int headerLines) {

    public Path pathFor(String groupName) {
      return Path.of(pathPattern.replace("{group}", groupName));
    }
  }

  /**
   * @param sacctCommand path of the {@code sacct} binary
   * @param jobStates value passed to {@code --state}; blank disables the state filter
   */
  public record Accounting(
      @DefaultValue("/usr/local/bin/sacct") String sacctCommand,
      @DefaultValue("CD") String jobStates) {}

  public record Directory(
      @DefaultValue("getent") String getentCommand, @DefaultValue("id") String idCommand) {}
}
