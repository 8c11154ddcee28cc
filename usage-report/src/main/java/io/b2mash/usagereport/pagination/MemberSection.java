package io.b2mash.usagereport.pagination;

import io.b2mash.usagereport.membership.Affiliation;

/** Sections of the member table, in display order. */
public enum MemberSection {
  PRIMARY("Primary Members"),
  SECONDARY("Secondary Members"),
  OTHER("Other Members");

  private final String label;

  MemberSection(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public static MemberSection of(Affiliation affiliation) {
    return switch (affiliation) {
      case PRIMARY -> PRIMARY;
      case SECONDARY -> SECONDARY;
      default -> OTHER;
    };
  }
}
