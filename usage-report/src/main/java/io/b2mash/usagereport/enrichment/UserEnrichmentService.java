package io.b2mash.usagereport.enrichment;

import io.b2mash.usagereport.config.UsageReportProperties;
import io.b2mash.usagereport.dataset.PartitionUsage;
import io.b2mash.usagereport.integration.accounting.AccountingQueryException;
import io.b2mash.usagereport.integration.accounting.AccountingSource;
import io.b2mash.usagereport.integration.directory.IdentityDirectory;
import io.b2mash.usagereport.integration.directory.IdentityLookupException;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Gathers name, email, account tiers and per-partition usage for one user. Every sub-lookup is
 * independent: a failure degrades only its own field to a default ({@value #NOT_AVAILABLE}, no
 * tiers, or zero usage) and is logged, so {@link #enrich} never throws for a username.
 */
@Service
public class UserEnrichmentService {

  private static final Logger log = LoggerFactory.getLogger(UserEnrichmentService.class);

  public static final String NOT_AVAILABLE = "NA";

  /** GECOS is {@code full name,room,work phone,home phone,other}; the last holds the email. */
  private static final int GECOS_NAME_INDEX = 0;

  private static final int GECOS_EMAIL_INDEX = 4;

  private final IdentityDirectory identityDirectory;
  private final AccountingSource accountingSource;
  private final AccountTierResolver accountTierResolver;
  private final List<String> partitions;

  public UserEnrichmentService(
      IdentityDirectory identityDirectory,
      AccountingSource accountingSource,
      AccountTierResolver accountTierResolver,
      UsageReportProperties properties) {
    this.identityDirectory = identityDirectory;
    this.accountingSource = accountingSource;
    this.accountTierResolver = accountTierResolver;
    this.partitions = properties.partitions();
  }

  public UserProfile enrich(String username, LocalDate start, LocalDate end) {
    var gecos = lookupGecos(username);
    var name = gecosField(username, gecos, GECOS_NAME_INDEX, "name");
    var email = gecosField(username, gecos, GECOS_EMAIL_INDEX, "email");
    var tiers = lookupAccountTiers(username);

    var usage = new LinkedHashMap<String, PartitionUsage>();
    for (String partition : partitions) {
      usage.put(partition, lookupUsage(username, partition, start, end).value());
    }

    return new UserProfile(username, name.value(), email.value(), tiers.value(), usage);
  }

  LookupResult<String> lookupGecos(String username) {
    try {
      return identityDirectory
          .findUser(username)
          .map(user -> LookupResult.found(user.gecos()))
          .orElseGet(() -> LookupResult.defaulted("", "user not in directory"));
    } catch (IdentityLookupException | RuntimeException e) {
      return LookupResult.defaulted("", e.getMessage());
    }
  }

  private LookupResult<String> gecosField(
      String username, LookupResult<String> gecos, int index, String fieldName) {
    if (gecos.isDefaulted()) {
      log.warn("No {} for {}: {}", fieldName, username, gecos.failureReason());
      return LookupResult.defaulted(NOT_AVAILABLE, gecos.failureReason());
    }
    String[] fields = gecos.value().split(",", -1);
    if (index >= fields.length || fields[index].isBlank()) {
      log.warn("No {} for {}: comment field has no entry at position {}", fieldName, username, index);
      return LookupResult.defaulted(NOT_AVAILABLE, "missing comment field " + index);
    }
    return LookupResult.found(fields[index].trim());
  }

  LookupResult<List<String>> lookupAccountTiers(String username) {
    try {
      return LookupResult.found(
          accountTierResolver.tiersFor(identityDirectory.groupNamesOf(username)));
    } catch (IdentityLookupException | RuntimeException e) {
      log.warn("Account tier lookup failed for {}: {}", username, e.getMessage());
      return LookupResult.defaulted(List.of(), e.getMessage());
    }
  }

  LookupResult<PartitionUsage> lookupUsage(
      String username, String partition, LocalDate start, LocalDate end) {
    try {
      return LookupResult.found(
          PartitionUsage.fromCpuSeconds(
              accountingSource.completedJobCpuSeconds(username, partition, start, end)));
    } catch (AccountingQueryException | RuntimeException e) {
      log.warn("Usage lookup failed for {} on {}: {}", username, partition, e.getMessage());
      return LookupResult.defaulted(PartitionUsage.ZERO, e.getMessage());
    }
  }
}
