package io.b2mash.usagereport.integration.directory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class GroupEntryTest {

  @Test
  void parse_withMembers_splitsMemberList() throws Exception {
    var entry = GroupEntry.parse("physics:x:5001:alice,bob, carol");

    assertThat(entry.name()).isEqualTo("physics");
    assertThat(entry.gid()).isEqualTo(5001);
    assertThat(entry.members()).containsExactly("alice", "bob", "carol");
  }

  @Test
  void parse_noMembers_returnsEmptyList() throws Exception {
    var entry = GroupEntry.parse("physics:*:5001:");

    assertThat(entry.members()).isEmpty();
  }

  @Test
  void parse_nonNumericGid_throws() {
    assertThatThrownBy(() -> GroupEntry.parse("physics:x:abc:alice"))
        .isInstanceOf(IdentityLookupException.class)
        .hasMessageContaining("gid");
  }

  @Test
  void parse_tooFewFields_throws() {
    assertThatThrownBy(() -> GroupEntry.parse("physics:x"))
        .isInstanceOf(IdentityLookupException.class);
  }
}
