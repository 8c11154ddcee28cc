package io.b2mash.usagereport.integration.directory;

/** A user database entry. {@code gecos} is the free-form comment field, possibly empty. */
public record PasswdEntry(String username, long uid, long primaryGid, String gecos) {

  /** Parses a {@code user:password:uid:gid:gecos:home:shell} line. */
  public static PasswdEntry parse(String line) throws IdentityLookupException {
    String[] fields = line.split(":", -1);
    if (fields.length < 5) {
      throw new IdentityLookupException("Malformed passwd entry: " + line);
    }
    try {
      return new PasswdEntry(
          fields[0], Long.parseLong(fields[2].trim()), Long.parseLong(fields[3].trim()), fields[4]);
    } catch (NumberFormatException e) {
      throw new IdentityLookupException("Non-numeric uid/gid in passwd entry: " + line, e);
    }
  }
}
