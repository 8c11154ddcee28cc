package io.b2mash.usagereport.rendering;

import io.b2mash.usagereport.dataset.UserRecord;
import io.b2mash.usagereport.pagination.ReportRow;
import io.b2mash.usagereport.pipeline.UsageReport;
import io.b2mash.usagereport.summary.PartitionRanking;
import io.b2mash.usagereport.summary.RankedEntry;
import io.b2mash.usagereport.summary.UsageMetric;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.StringTemplateResolver;

/**
 * Renders a {@link UsageReport}: builds the Thymeleaf context, renders the report template to
 * HTML, converts it to PDF, and writes the member table as CSV.
 *
 * <p>The template and its stylesheet are system-provided classpath resources. Figures are
 * formatted here so the template only places strings.
 */
@Service
public class UsageReportRenderingService {

  static final String TEMPLATE_PATH = "templates/group-usage-report.html";
  static final String CSS_PATH = "templates/group-usage-report.css";
  static final String NO_TIERS = "-";

  private static final DateTimeFormatter GENERATED_AT_FORMAT =
      DateTimeFormatter.ofPattern("dd MMM yyyy HH:mm 'UTC'", Locale.ROOT)
          .withZone(ZoneOffset.UTC);

  private final PdfRenderingService pdfRenderingService;
  private final TemplateEngine reportTemplateEngine;
  private final String templateBody;
  private final String css;

  public UsageReportRenderingService(PdfRenderingService pdfRenderingService) {
    this.pdfRenderingService = pdfRenderingService;
    this.reportTemplateEngine = createReportTemplateEngine();
    this.templateBody = loadResource(TEMPLATE_PATH);
    this.css = loadResource(CSS_PATH);
  }

  public String renderHtml(UsageReport report) {
    var ctx = new Context(Locale.ROOT);
    buildContext(report).forEach(ctx::setVariable);
    return injectCss(reportTemplateEngine.process(templateBody, ctx));
  }

  public byte[] renderPdf(UsageReport report) {
    return pdfRenderingService.htmlToPdf(renderHtml(report));
  }

  /**
   * Generate a filename for the exported report. Pattern: {group}-usage-{start}-to-{end}.{ext}
   */
  public String generateFilename(UsageReport report, String extension) {
    var request = report.request();
    String filename =
        request.groupName()
            + "-usage-"
            + request.start()
            + "-to-"
            + request.end()
            + "."
            + extension;
    return filename.replaceAll("[^a-zA-Z0-9._-]", "");
  }

  /** Write the member table, one row per member in page order, as CSV. */
  public void writeCsv(UsageReport report, OutputStream outputStream) throws IOException {
    var writer = new BufferedWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));

    // Metadata header
    var request = report.request();
    writer.write("# Usage report: " + request.groupName());
    writer.newLine();
    writer.write("# Period: " + request.start() + " to " + request.end());
    writer.newLine();
    writer.write("# Generated: " + report.generatedAt().toString());
    writer.newLine();

    var columns = new ArrayList<String>();
    columns.add("username");
    columns.add("name");
    columns.add("email");
    columns.add("affiliation");
    columns.add("account_tiers");
    for (String partition : report.partitions()) {
      columns.add(partition + "_jobs");
      columns.add(partition + "_cpu_hours");
    }
    columns.add("storage_gb");
    writer.write(columns.stream().map(this::escapeCsv).collect(Collectors.joining(",")));
    writer.newLine();

    for (var page : report.pages()) {
      for (var row : page.rows()) {
        if (row.isHeader()) {
          continue;
        }
        var member = row.member();
        var values = new ArrayList<String>();
        values.add(member.username());
        values.add(member.name());
        values.add(member.email());
        values.add(member.affiliation().getLabel());
        values.add(String.join(" ", member.accountTiers()));
        for (String partition : report.partitions()) {
          var usage = member.usageOn(partition);
          values.add(String.valueOf(usage.jobCount()));
          values.add(String.format(Locale.ROOT, "%.2f", usage.cpuHours()));
        }
        values.add(String.valueOf(member.storageGb()));
        writer.write(values.stream().map(this::escapeCsv).collect(Collectors.joining(",")));
        writer.newLine();
      }
    }

    writer.flush();
  }

  String escapeCsv(String value) {
    if (value == null) {
      return "";
    }
    // Defuse CSV formula injection (OWASP recommendation)
    if (!value.isEmpty() && "=+-@\t\r".indexOf(value.charAt(0)) >= 0) {
      value = "'" + value;
    }
    if (value.contains(",")
        || value.contains("\"")
        || value.contains("\n")
        || value.contains("\r")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }

  Map<String, Object> buildContext(UsageReport report) {
    var request = report.request();
    var summary = report.summary();
    var context = new HashMap<String, Object>();

    context.put(
        "report",
        Map.of(
            "groupName", request.groupName(),
            "start", request.start().toString(),
            "end", request.end().toString(),
            "generatedAt", GENERATED_AT_FORMAT.format(report.generatedAt())));

    var summaryMap = new LinkedHashMap<String, Object>();
    summaryMap.put("primaryCount", summary.primaryCount());
    summaryMap.put("secondaryCount", summary.secondaryCount());
    summaryMap.put("unknownCount", summary.unknownCount());
    summaryMap.put("totalMembers", summary.totalMembers());
    summaryMap.put("allocationGb", formatGigabytes(summary.allocationGb()));
    summaryMap.put("usedGb", formatGigabytes(summary.usedGb()));
    summaryMap.put("availableGb", formatGigabytes(summary.availableGb()));
    summaryMap.put("overAllocation", summary.availableGb() < 0);
    context.put("summary", summaryMap);

    context.put(
        "tiers",
        summary.tierCounts().entrySet().stream()
            .map(e -> Map.<String, Object>of("tag", e.getKey(), "count", e.getValue()))
            .toList());

    context.put("storageChart", chart("Top Storage Consumers (GB)", report.storageRanking(), 0));
    context.put("usageCharts", usageCharts(report.usageRankings()));

    context.put("partitions", report.partitions());
    context.put("columnCount", 5 + 2 * report.partitions().size());
    context.put(
        "pages",
        report.pages().stream()
            .map(
                page ->
                    Map.<String, Object>of(
                        "number",
                        page.number(),
                        "rows",
                        page.rows().stream().map(row -> tableRow(row, report)).toList()))
            .toList());
    context.put("pageCount", report.pages().size());
    return context;
  }

  private List<Map<String, Object>> usageCharts(List<PartitionRanking> rankings) {
    var charts = new ArrayList<Map<String, Object>>();
    for (var ranking : rankings) {
      String partition = capitalize(ranking.partition());
      charts.add(chart(partition + " " + UsageMetric.JOBS.getLabel(), ranking.byJobs(), 0));
      charts.add(
          chart(partition + " " + UsageMetric.CPU_HOURS.getLabel(), ranking.byCpuHours(), 1));
    }
    return charts;
  }

  private Map<String, Object> chart(String title, List<RankedEntry> entries, int decimals) {
    double max = entries.stream().mapToDouble(RankedEntry::value).max().orElse(0.0);
    var bars =
        entries.stream()
            .map(
                entry -> {
                  Map<String, Object> bar = new LinkedHashMap<>();
                  bar.put("label", entry.label());
                  bar.put("value", formatNumber(entry.value(), decimals));
                  bar.put("widthPercent", max > 0 ? Math.round(entry.value() / max * 100) : 0);
                  bar.put("rollup", entry.rollup());
                  return bar;
                })
            .toList();
    return Map.of("title", title, "bars", bars, "empty", bars.isEmpty());
  }

  private Map<String, Object> tableRow(ReportRow row, UsageReport report) {
    var map = new LinkedHashMap<String, Object>();
    map.put("header", row.isHeader());
    if (row.isHeader()) {
      map.put("label", row.sectionLabel());
      return map;
    }
    UserRecord member = row.member();
    map.put("username", member.username());
    map.put("name", member.name());
    map.put("email", member.email());
    map.put(
        "tiers",
        member.accountTiers().isEmpty() ? NO_TIERS : String.join(", ", member.accountTiers()));
    map.put(
        "usage",
        report.partitions().stream()
            .map(
                partition -> {
                  var usage = member.usageOn(partition);
                  return Map.<String, Object>of(
                      "jobs", String.valueOf(usage.jobCount()),
                      "cpuHours", formatNumber(usage.cpuHours(), 1));
                })
            .toList());
    map.put("storageGb", formatGigabytes(member.storageGb()));
    return map;
  }

  private static String formatGigabytes(long gigabytes) {
    return String.format(Locale.ROOT, "%,d", gigabytes);
  }

  private static String formatNumber(double value, int decimals) {
    return String.format(Locale.ROOT, "%,." + decimals + "f", value);
  }

  private static String capitalize(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    return Character.toUpperCase(text.charAt(0)) + text.substring(1);
  }

  private String injectCss(String renderedHtml) {
    String styleBlock = "<style>\n" + css + "\n</style>\n";
    int headClose = renderedHtml.indexOf("</head>");
    if (headClose < 0) {
      return renderedHtml;
    }
    return renderedHtml.substring(0, headClose) + styleBlock + renderedHtml.substring(headClose);
  }

  private static String loadResource(String path) {
    try (InputStream is = new ClassPathResource(path).getInputStream()) {
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not load report resource " + path, e);
    }
  }

  /**
   * Creates a dedicated Thymeleaf engine for the report template. The template is
   * system-provided and trusted.
   */
  private static TemplateEngine createReportTemplateEngine() {
    var engine = new TemplateEngine();
    var resolver = new StringTemplateResolver();
    resolver.setTemplateMode(TemplateMode.HTML);
    engine.setTemplateResolver(resolver);
    return engine;
  }
}
