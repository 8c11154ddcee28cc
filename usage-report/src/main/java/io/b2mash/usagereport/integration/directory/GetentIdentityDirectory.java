package io.b2mash.usagereport.integration.directory;

import io.b2mash.usagereport.config.UsageReportProperties;
import io.b2mash.usagereport.integration.process.CommandExecutionException;
import io.b2mash.usagereport.integration.process.CommandOutput;
import io.b2mash.usagereport.integration.process.OsCommandRunner;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link IdentityDirectory} backed by the NSS databases through {@code getent} and {@code id}, so
 * it sees the same users and groups as the cluster nodes whether they come from local files or
 * LDAP.
 */
@Component
public class GetentIdentityDirectory implements IdentityDirectory {

  private static final Logger log = LoggerFactory.getLogger(GetentIdentityDirectory.class);

  /** {@code getent} exit status when the key is not in the database. */
  private static final int GETENT_KEY_NOT_FOUND = 2;

  private final OsCommandRunner commandRunner;
  private final String getentCommand;
  private final String idCommand;

  public GetentIdentityDirectory(OsCommandRunner commandRunner, UsageReportProperties properties) {
    this.commandRunner = commandRunner;
    this.getentCommand = properties.directory().getentCommand();
    this.idCommand = properties.directory().idCommand();
  }

  @Override
  public Optional<GroupEntry> findGroup(String groupName) throws IdentityLookupException {
    var output = query(List.of(getentCommand, "group", groupName));
    if (output.exitCode() == GETENT_KEY_NOT_FOUND) {
      return Optional.empty();
    }
    requireSuccess(output, "getent group " + groupName);
    if (output.stdoutLines().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(GroupEntry.parse(output.stdoutLines().get(0)));
  }

  @Override
  public List<PasswdEntry> listUsers() throws IdentityLookupException {
    var output = query(List.of(getentCommand, "passwd"));
    requireSuccess(output, "getent passwd");

    var users = new ArrayList<PasswdEntry>(output.stdoutLines().size());
    for (String line : output.stdoutLines()) {
      if (line.isBlank()) {
        continue;
      }
      try {
        users.add(PasswdEntry.parse(line));
      } catch (IdentityLookupException e) {
        log.warn("Skipping unparseable passwd entry: {}", e.getMessage());
      }
    }
    log.debug("Enumerated {} directory users", users.size());
    return users;
  }

  @Override
  public Optional<PasswdEntry> findUser(String username) throws IdentityLookupException {
    var output = query(List.of(getentCommand, "passwd", username));
    if (output.exitCode() == GETENT_KEY_NOT_FOUND) {
      return Optional.empty();
    }
    requireSuccess(output, "getent passwd " + username);
    if (output.stdoutLines().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(PasswdEntry.parse(output.stdoutLines().get(0)));
  }

  @Override
  public List<String> groupNamesOf(String username) throws IdentityLookupException {
    var output = query(List.of(idCommand, "-Gn", username));
    requireSuccess(output, "id -Gn " + username);
    if (output.stdoutLines().isEmpty()) {
      return List.of();
    }
    return Arrays.stream(output.stdoutLines().get(0).trim().split("\\s+"))
        .filter(name -> !name.isEmpty())
        .toList();
  }

  private CommandOutput query(List<String> command) throws IdentityLookupException {
    try {
      return commandRunner.run(command);
    } catch (CommandExecutionException e) {
      throw new IdentityLookupException(e.getMessage(), e);
    }
  }

  private static void requireSuccess(CommandOutput output, String description)
      throws IdentityLookupException {
    if (!output.isSuccess()) {
      throw new IdentityLookupException(
          description + " exited with status " + output.exitCode() + ": " + output.stderr());
    }
  }
}
