package io.b2mash.usagereport.exception;

import java.util.Set;
import java.util.TreeSet;

/**
 * Internal consistency error: a group member reached the merge step without an enrichment result.
 */
public class MembershipEnrichmentMismatchException extends ReportException {

  private final Set<String> missingUsernames;

  public MembershipEnrichmentMismatchException(Set<String> missingUsernames) {
    super(
        "Internal consistency error",
        "No enrichment result for member(s) " + new TreeSet<>(missingUsernames),
        EXIT_INTERNAL,
        null);
    this.missingUsernames = Set.copyOf(missingUsernames);
  }

  public Set<String> getMissingUsernames() {
    return missingUsernames;
  }
}
