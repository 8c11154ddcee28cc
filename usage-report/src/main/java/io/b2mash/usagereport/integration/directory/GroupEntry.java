package io.b2mash.usagereport.integration.directory;

import java.util.Arrays;
import java.util.List;

/** A group database entry: name, numeric gid and the explicitly listed (secondary) members. */
public record GroupEntry(String name, long gid, List<String> members) {

  public GroupEntry {
    members = List.copyOf(members);
  }

  /** Parses a {@code name:password:gid:member1,member2} line. */
  public static GroupEntry parse(String line) throws IdentityLookupException {
    String[] fields = line.split(":", -1);
    if (fields.length < 4) {
      throw new IdentityLookupException("Malformed group entry: " + line);
    }
    long gid;
    try {
      gid = Long.parseLong(fields[2].trim());
    } catch (NumberFormatException e) {
      throw new IdentityLookupException("Non-numeric gid in group entry: " + line, e);
    }
    var members =
        Arrays.stream(fields[3].split(","))
            .map(String::trim)
            .filter(member -> !member.isEmpty())
            .toList();
    return new GroupEntry(fields[0], gid, members);
  }
}
