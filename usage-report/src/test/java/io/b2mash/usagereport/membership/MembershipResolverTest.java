package io.b2mash.usagereport.membership;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import io.b2mash.usagereport.exception.GroupNotFoundException;
import io.b2mash.usagereport.exception.IdentityDirectoryUnavailableException;
import io.b2mash.usagereport.exception.ReportException;
import io.b2mash.usagereport.integration.directory.GroupEntry;
import io.b2mash.usagereport.integration.directory.IdentityDirectory;
import io.b2mash.usagereport.integration.directory.IdentityLookupException;
import io.b2mash.usagereport.integration.directory.PasswdEntry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MembershipResolverTest {

  @Mock private IdentityDirectory identityDirectory;

  private MembershipResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new MembershipResolver(identityDirectory);
  }

  @Test
  void resolve_listedAndPrimaryMembers_classifiesEach() throws Exception {
    when(identityDirectory.findGroup("physics"))
        .thenReturn(Optional.of(new GroupEntry("physics", 5001, List.of("bob", "dave"))));
    when(identityDirectory.listUsers())
        .thenReturn(
            List.of(
                new PasswdEntry("alice", 1001, 5001, "Alice"),
                new PasswdEntry("bob", 1002, 6000, "Bob"),
                new PasswdEntry("carol", 1003, 7000, "Carol"),
                new PasswdEntry("dave", 1004, 6000, "Dave")));

    var affiliations = resolver.resolve("physics");

    assertThat(affiliations)
        .containsOnlyKeys("alice", "bob", "dave")
        .containsEntry("alice", Affiliation.PRIMARY)
        .containsEntry("bob", Affiliation.SECONDARY)
        .containsEntry("dave", Affiliation.SECONDARY);
  }

  @Test
  void resolve_userListedAndPrimary_primaryWins() throws Exception {
    when(identityDirectory.findGroup("physics"))
        .thenReturn(Optional.of(new GroupEntry("physics", 5001, List.of("alice"))));
    when(identityDirectory.listUsers())
        .thenReturn(List.of(new PasswdEntry("alice", 1001, 5001, "Alice")));

    assertThat(resolver.resolve("physics"))
        .containsExactlyEntriesOf(Map.of("alice", Affiliation.PRIMARY));
  }

  @Test
  void resolve_unknownGroup_throwsGroupNotFound() throws Exception {
    when(identityDirectory.findGroup("nosuch")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> resolver.resolve("nosuch"))
        .isInstanceOf(GroupNotFoundException.class)
        .hasMessageContaining("nosuch")
        .extracting(e -> ((ReportException) e).getExitCode())
        .isEqualTo(ReportException.EXIT_FATAL);
  }

  @Test
  void resolve_directoryFailure_throwsUnavailable() throws Exception {
    when(identityDirectory.findGroup("physics"))
        .thenThrow(new IdentityLookupException("getent group physics exited with status 1"));

    assertThatThrownBy(() -> resolver.resolve("physics"))
        .isInstanceOf(IdentityDirectoryUnavailableException.class)
        .hasCauseInstanceOf(IdentityLookupException.class);
  }
}
