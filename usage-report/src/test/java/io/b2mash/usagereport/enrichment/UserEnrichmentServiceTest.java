package io.b2mash.usagereport.enrichment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import io.b2mash.usagereport.config.PropertiesFixtures;
import io.b2mash.usagereport.dataset.PartitionUsage;
import io.b2mash.usagereport.integration.accounting.AccountingQueryException;
import io.b2mash.usagereport.integration.accounting.AccountingSource;
import io.b2mash.usagereport.integration.directory.IdentityDirectory;
import io.b2mash.usagereport.integration.directory.IdentityLookupException;
import io.b2mash.usagereport.integration.directory.PasswdEntry;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UserEnrichmentServiceTest {

  private static final LocalDate START = LocalDate.of(2024, 1, 1);
  private static final LocalDate END = LocalDate.of(2024, 1, 31);

  @Mock private IdentityDirectory identityDirectory;
  @Mock private AccountingSource accountingSource;

  private UserEnrichmentService service;

  @BeforeEach
  void setUp() {
    var properties = PropertiesFixtures.defaults();
    service =
        new UserEnrichmentService(
            identityDirectory, accountingSource, new AccountTierResolver(properties), properties);
  }

  @Test
  void enrich_allSourcesAnswer_populatesEveryField() throws Exception {
    when(identityDirectory.findUser("alice"))
        .thenReturn(
            Optional.of(new PasswdEntry("alice", 1001, 5001, "Alice Smith,,,,alice@example.edu")));
    when(identityDirectory.groupNamesOf("alice")).thenReturn(List.of("physics", "priority1"));
    when(accountingSource.completedJobCpuSeconds("alice", "batch", START, END))
        .thenReturn(List.of(3600L, 7200L, 1800L));
    when(accountingSource.completedJobCpuSeconds("alice", "gpu", START, END))
        .thenReturn(List.of());

    var profile = service.enrich("alice", START, END);

    assertThat(profile.username()).isEqualTo("alice");
    assertThat(profile.name()).isEqualTo("Alice Smith");
    assertThat(profile.email()).isEqualTo("alice@example.edu");
    assertThat(profile.accountTiers()).containsExactly("priority");
    assertThat(profile.usageByPartition()).containsOnlyKeys("batch", "gpu");
    assertThat(profile.usageByPartition().get("batch").jobCount()).isEqualTo(3);
    assertThat(profile.usageByPartition().get("batch").cpuHours()).isEqualTo(3.5);
    assertThat(profile.usageByPartition().get("gpu")).isEqualTo(PartitionUsage.ZERO);
  }

  @Test
  void enrich_userMissingFromDirectory_defaultsNameAndEmail() throws Exception {
    when(identityDirectory.findUser("ghost")).thenReturn(Optional.empty());
    when(identityDirectory.groupNamesOf("ghost")).thenReturn(List.of());
    when(accountingSource.completedJobCpuSeconds(anyString(), anyString(), any(), any()))
        .thenReturn(List.of());

    var profile = service.enrich("ghost", START, END);

    assertThat(profile.name()).isEqualTo(UserEnrichmentService.NOT_AVAILABLE);
    assertThat(profile.email()).isEqualTo(UserEnrichmentService.NOT_AVAILABLE);
    assertThat(profile.accountTiers()).isEmpty();
  }

  @Test
  void enrich_commentWithoutEmail_defaultsOnlyEmail() throws Exception {
    when(identityDirectory.findUser("bob"))
        .thenReturn(Optional.of(new PasswdEntry("bob", 1002, 5001, "Bob Jones")));
    when(identityDirectory.groupNamesOf("bob")).thenReturn(List.of("physics"));
    when(accountingSource.completedJobCpuSeconds(anyString(), anyString(), any(), any()))
        .thenReturn(List.of());

    var profile = service.enrich("bob", START, END);

    assertThat(profile.name()).isEqualTo("Bob Jones");
    assertThat(profile.email()).isEqualTo("NA");
  }

  @Test
  void enrich_accountingFailsOnOnePartition_onlyThatPartitionIsZero() throws Exception {
    when(identityDirectory.findUser("alice"))
        .thenReturn(Optional.of(new PasswdEntry("alice", 1001, 5001, "Alice,,,,a@x.edu")));
    when(identityDirectory.groupNamesOf("alice")).thenReturn(List.of("physics"));
    when(accountingSource.completedJobCpuSeconds(eq("alice"), eq("batch"), any(), any()))
        .thenThrow(new AccountingQueryException("sacct exited with status 1"));
    when(accountingSource.completedJobCpuSeconds(eq("alice"), eq("gpu"), any(), any()))
        .thenReturn(List.of(7200L));

    var profile = service.enrich("alice", START, END);

    assertThat(profile.usageByPartition().get("batch")).isEqualTo(PartitionUsage.ZERO);
    assertThat(profile.usageByPartition().get("gpu")).isEqualTo(new PartitionUsage(1, 2.0));
    assertThat(profile.name()).isEqualTo("Alice");
  }

  @Test
  void lookupAccountTiers_directoryFailure_defaultsToNoTiers() throws Exception {
    when(identityDirectory.groupNamesOf("alice"))
        .thenThrow(new IdentityLookupException("id -Gn alice exited with status 1"));

    var result = service.lookupAccountTiers("alice");

    assertThat(result.isDefaulted()).isTrue();
    assertThat(result.value()).isEmpty();
    assertThat(result.failureReason()).contains("status 1");
  }

  @Test
  void lookupGecos_runtimeFailure_isAbsorbed() throws Exception {
    when(identityDirectory.findUser("alice")).thenThrow(new IllegalStateException("boom"));

    var result = service.lookupGecos("alice");

    assertThat(result.isDefaulted()).isTrue();
    assertThat(result.failureReason()).isEqualTo("boom");
  }
}
