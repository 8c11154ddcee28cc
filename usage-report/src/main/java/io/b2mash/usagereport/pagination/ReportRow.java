package io.b2mash.usagereport.pagination;

import io.b2mash.usagereport.dataset.UserRecord;

/**
 * A row of the member table: either a section header carrying only its label, or a member.
 *
 * @param sectionLabel the section label; set on header rows only
 * @param member the member shown on this row; null on header rows
 */
public record ReportRow(String sectionLabel, UserRecord member) {

  public static ReportRow header(MemberSection section) {
    return new ReportRow(section.getLabel(), null);
  }

  public static ReportRow member(UserRecord record) {
    return new ReportRow(null, record);
  }

  public boolean isHeader() {
    return member == null;
  }
}
