package io.b2mash.usagereport.pagination;

import java.util.List;

/** One page of the member table. Page numbers start at 1. */
public record ReportPage(int number, List<ReportRow> rows) {

  public ReportPage {
    rows = List.copyOf(rows);
  }
}
