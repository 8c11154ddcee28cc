package io.b2mash.usagereport.pagination;

import io.b2mash.usagereport.config.UsageReportProperties;
import io.b2mash.usagereport.dataset.UserRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Lays the member table out as sections and pages.
 *
 * <p>Members are grouped into primary, secondary and other sections, each sorted by username and
 * introduced by a header row. Headers take a slot in the page's row budget like any member row.
 * With {@code keep-header-with-rows} disabled a header may end up as the last row of a page; with
 * it enabled such a header is carried over to the next page instead, leaving the earlier page one
 * row short.
 */
@Component
public class ReportPaginator {

  private final int pageSize;
  private final boolean keepHeaderWithRows;

  public ReportPaginator(UsageReportProperties properties) {
    this.pageSize = properties.pagination().pageSize();
    this.keepHeaderWithRows = properties.pagination().keepHeaderWithRows();
  }

  public List<ReportPage> paginate(List<UserRecord> records) {
    return paginate(groupByAffiliation(records), pageSize, keepHeaderWithRows);
  }

  public List<ReportRow> groupByAffiliation(List<UserRecord> records) {
    var sections = new EnumMap<MemberSection, List<UserRecord>>(MemberSection.class);
    for (var section : MemberSection.values()) {
      sections.put(section, new ArrayList<>());
    }
    for (var record : records) {
      sections.get(MemberSection.of(record.affiliation())).add(record);
    }

    var rows = new ArrayList<ReportRow>(records.size() + MemberSection.values().length);
    for (var entry : sections.entrySet()) {
      var members = entry.getValue();
      if (members.isEmpty()) {
        continue;
      }
      members.sort(Comparator.comparing(UserRecord::username));
      rows.add(ReportRow.header(entry.getKey()));
      members.forEach(member -> rows.add(ReportRow.member(member)));
    }
    return rows;
  }

  public static List<ReportPage> paginate(
      List<ReportRow> rows, int pageSize, boolean keepHeaderWithRows) {
    if (pageSize < 1) {
      throw new IllegalArgumentException("pageSize must be at least 1, was " + pageSize);
    }
    var pages = new ArrayList<ReportPage>();
    var current = new ArrayList<ReportRow>(pageSize);

    for (int i = 0; i < rows.size(); i++) {
      var row = rows.get(i);
      boolean lastSlot = current.size() == pageSize - 1;
      boolean orphanHeader =
          keepHeaderWithRows
              && pageSize > 1
              && lastSlot
              && row.isHeader()
              && i + 1 < rows.size()
              && !current.isEmpty();
      if (orphanHeader) {
        pages.add(new ReportPage(pages.size() + 1, current));
        current = new ArrayList<>(pageSize);
      }
      current.add(row);
      if (current.size() == pageSize) {
        pages.add(new ReportPage(pages.size() + 1, current));
        current = new ArrayList<>(pageSize);
      }
    }
    if (!current.isEmpty()) {
      pages.add(new ReportPage(pages.size() + 1, current));
    }
    return pages;
  }
}
