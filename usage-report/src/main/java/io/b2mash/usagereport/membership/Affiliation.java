package io.b2mash.usagereport.membership;

/** How a user belongs to the reported group. */
public enum Affiliation {
  /** The group is the user's primary (default) group. */
  PRIMARY("Primary"),
  /** The user is listed as a supplementary member of the group. */
  SECONDARY("Secondary"),
  /** Not classified by membership resolution; only appears in defective datasets. */
  UNKNOWN("Other");

  private final String label;

  Affiliation(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
