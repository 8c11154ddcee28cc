package io.b2mash.usagereport.membership;

import io.b2mash.usagereport.exception.GroupNotFoundException;
import io.b2mash.usagereport.exception.IdentityDirectoryUnavailableException;
import io.b2mash.usagereport.integration.directory.IdentityDirectory;
import io.b2mash.usagereport.integration.directory.IdentityLookupException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves the members of a group and how each one is affiliated with it.
 *
 * <p>Secondary members are taken from the group's member list first; users whose primary gid is
 * the group's gid are then added as {@link Affiliation#PRIMARY}, replacing any secondary entry for
 * the same username. The returned map has no meaningful iteration order.
 */
@Service
public class MembershipResolver {

  private static final Logger log = LoggerFactory.getLogger(MembershipResolver.class);

  private final IdentityDirectory identityDirectory;

  public MembershipResolver(IdentityDirectory identityDirectory) {
    this.identityDirectory = identityDirectory;
  }

  public Map<String, Affiliation> resolve(String groupName) {
    try {
      var group =
          identityDirectory
              .findGroup(groupName)
              .orElseThrow(() -> new GroupNotFoundException(groupName));

      var affiliations = new HashMap<String, Affiliation>();
      for (String member : group.members()) {
        affiliations.put(member, Affiliation.SECONDARY);
      }
      int primaryCount = 0;
      for (var user : identityDirectory.listUsers()) {
        if (user.primaryGid() == group.gid()) {
          affiliations.put(user.username(), Affiliation.PRIMARY);
          primaryCount++;
        }
      }

      log.info(
          "Resolved group {} (gid {}): {} member(s), {} primary",
          groupName,
          group.gid(),
          affiliations.size(),
          primaryCount);
      return affiliations;
    } catch (IdentityLookupException e) {
      throw new IdentityDirectoryUnavailableException(
          "Could not resolve members of group '" + groupName + "': " + e.getMessage(), e);
    }
  }
}
