package io.b2mash.usagereport.integration.directory;

import java.util.List;
import java.util.Optional;

/**
 * Port to the cluster's identity directory (the passwd and group databases). Implementations may
 * be backed by local files, LDAP through NSS, or fixtures in tests.
 */
public interface IdentityDirectory {

  /** Looks up a group by name. Empty when the directory has no such group. */
  Optional<GroupEntry> findGroup(String groupName) throws IdentityLookupException;

  /** Enumerates every user known to the directory. */
  List<PasswdEntry> listUsers() throws IdentityLookupException;

  /** Looks up a single user. Empty when the directory has no such user. */
  Optional<PasswdEntry> findUser(String username) throws IdentityLookupException;

  /** Names of every group the user belongs to, primary group included. */
  List<String> groupNamesOf(String username) throws IdentityLookupException;
}
