package io.b2mash.usagereport.rendering;

import static io.b2mash.usagereport.dataset.RecordFixtures.primary;
import static io.b2mash.usagereport.dataset.RecordFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.usagereport.config.PropertiesFixtures;
import io.b2mash.usagereport.dataset.PartitionUsage;
import io.b2mash.usagereport.dataset.UserRecord;
import io.b2mash.usagereport.membership.Affiliation;
import io.b2mash.usagereport.pagination.ReportPaginator;
import io.b2mash.usagereport.pipeline.ReportRequest;
import io.b2mash.usagereport.pipeline.UsageReport;
import io.b2mash.usagereport.summary.GroupSummarizer;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UsageReportRenderingServiceTest {

  private UsageReportRenderingService renderingService;
  private UsageReport report;

  @BeforeEach
  void setUp() {
    renderingService = new UsageReportRenderingService(new PdfRenderingService());

    var properties = PropertiesFixtures.with(List.of("batch", "gpu"), 1, 1, 25, false);
    var summarizer = new GroupSummarizer(properties);
    var records =
        List.of(
            record(
                "alice", Affiliation.PRIMARY, List.of("priority"), 120, new PartitionUsage(3, 45.0)),
            new UserRecord(
                "bob",
                Affiliation.SECONDARY,
                "NA",
                "NA",
                List.of(),
                Map.of("batch", PartitionUsage.ZERO, "gpu", PartitionUsage.ZERO),
                0),
            primary("carol", 10, new PartitionUsage(1, 0.25)));

    report =
        new UsageReport(
            new ReportRequest(
                "physics",
                LocalDate.of(2024, 1, 1),
                LocalDate.of(2024, 3, 31),
                Path.of("/data/physics-quota-report.txt")),
            Instant.parse("2024-04-01T08:30:00Z"),
            properties.partitions(),
            records,
            summarizer.summarize(records, 500),
            summarizer.topStorageConsumers(records),
            summarizer.rankPartitions(records, properties.partitions()),
            new ReportPaginator(properties).paginate(records));
  }

  @Test
  void renderHtml_containsSummaryChartsAndMemberTable() {
    var html = renderingService.renderHtml(report);

    assertThat(html)
        .contains("physics")
        .contains("01 Apr 2024 08:30 UTC")
        .contains("Top Storage Consumers (GB)")
        .contains("All Others")
        .contains("Batch CPU Hours")
        .contains("Gpu Jobs")
        .contains("Primary Members")
        .contains("Secondary Members")
        .doesNotContain("Other Members")
        .contains("<td>NA</td>")
        .contains("<td>-</td>")
        .contains("<style>");
  }

  @Test
  void buildContext_membersTableSpansAllColumns() {
    var context = renderingService.buildContext(report);

    assertThat(context)
        .containsEntry("columnCount", 9)
        .containsEntry("pageCount", 1)
        .containsEntry("partitions", List.of("batch", "gpu"));
    @SuppressWarnings("unchecked")
    var summary = (Map<String, Object>) context.get("summary");
    assertThat(summary)
        .containsEntry("usedGb", "130")
        .containsEntry("availableGb", "370")
        .containsEntry("overAllocation", false);
  }

  @Test
  void renderPdf_producesPdfDocument() {
    var pdf = renderingService.renderPdf(report);

    assertThat(pdf).isNotEmpty();
    assertThat(new String(pdf, 0, 5, StandardCharsets.US_ASCII)).isEqualTo("%PDF-");
  }

  @Test
  void writeCsv_writesMembersInPageOrderWithoutHeaderRows() throws Exception {
    var out = new ByteArrayOutputStream();

    renderingService.writeCsv(report, out);

    var lines = out.toString(StandardCharsets.UTF_8).lines().toList();
    assertThat(lines.get(0)).isEqualTo("# Usage report: physics");
    assertThat(lines.get(1)).isEqualTo("# Period: 2024-01-01 to 2024-03-31");
    assertThat(lines.get(3))
        .isEqualTo(
            "username,name,email,affiliation,account_tiers,batch_jobs,batch_cpu_hours,"
                + "gpu_jobs,gpu_cpu_hours,storage_gb");
    assertThat(lines.subList(4, lines.size()))
        .containsExactly(
            "alice,Alice,alice@example.edu,Primary,priority,3,45.00,0,0.00,120",
            "carol,Carol,carol@example.edu,Primary,,1,0.25,0,0.00,10",
            "bob,NA,NA,Secondary,,0,0.00,0,0.00,0");
  }

  @Test
  void escapeCsv_quotesSeparatorsAndDefusesFormulas() {
    assertThat(renderingService.escapeCsv("Smith, Jane")).isEqualTo("\"Smith, Jane\"");
    assertThat(renderingService.escapeCsv("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
    assertThat(renderingService.escapeCsv("=HYPERLINK(\"x\")")).startsWith("\"'=HYPERLINK");
    assertThat(renderingService.escapeCsv(null)).isEmpty();
  }

  @Test
  void generateFilename_usesGroupAndWindow() {
    assertThat(renderingService.generateFilename(report, "pdf"))
        .isEqualTo("physics-usage-2024-01-01-to-2024-03-31.pdf");
  }
}
