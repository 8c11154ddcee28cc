package io.b2mash.usagereport.cli;

import io.b2mash.usagereport.config.UsageReportProperties;
import io.b2mash.usagereport.exception.ReportException;
import io.b2mash.usagereport.exception.ReportOutputException;
import io.b2mash.usagereport.pipeline.ReportRequest;
import io.b2mash.usagereport.pipeline.UsageReport;
import io.b2mash.usagereport.pipeline.UsageReportPipeline;
import io.b2mash.usagereport.rendering.UsageReportRenderingService;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Entry point of a report run: parses the command line, runs the pipeline and writes the PDF (and
 * optionally CSV and HTML). Report errors are reported as a one-line message and an exit code.
 * All artifacts are rendered before any file is written, and a failed write removes the files
 * already written, so a run leaves either every requested file or none.
 */
@Component
@ConditionalOnProperty(
    prefix = "usage-report.cli",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class UsageReportCommand implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(UsageReportCommand.class);

  private final UsageReportPipeline pipeline;
  private final UsageReportRenderingService renderingService;
  private final UsageReportProperties properties;

  private int exitCode;

  public UsageReportCommand(
      UsageReportPipeline pipeline,
      UsageReportRenderingService renderingService,
      UsageReportProperties properties) {
    this.pipeline = pipeline;
    this.renderingService = renderingService;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    exitCode = execute(args.getSourceArgs());
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  /** Runs the report for the given command line and returns the process exit code. */
  int execute(String... args) {
    try {
      var arguments = ReportArguments.parse(args);
      var quotaFile =
          arguments.quotaFile() != null
              ? arguments.quotaFile()
              : properties.quota().pathFor(arguments.groupName());

      var report =
          pipeline.generate(
              new ReportRequest(
                  arguments.groupName(), arguments.start(), arguments.end(), quotaFile));
      var output =
          arguments.output() != null
              ? arguments.output()
              : properties.outputDir().resolve(renderingService.generateFilename(report, "pdf"));

      var artifacts = new LinkedHashMap<Path, byte[]>();
      artifacts.put(output, renderingService.renderPdf(report));
      if (arguments.csv()) {
        var csvPath = sibling(output, "csv");
        artifacts.put(csvPath, renderCsv(report, csvPath));
      }
      if (arguments.html()) {
        artifacts.put(
            sibling(output, "html"),
            renderingService.renderHtml(report).getBytes(StandardCharsets.UTF_8));
      }
      writeAll(artifacts);
      return 0;
    } catch (ReportException e) {
      log.error("{}: {}", e.getTitle(), e.getDetail());
      log.debug("Report generation failed", e);
      return e.getExitCode();
    } catch (RuntimeException e) {
      log.error("Unexpected error while generating the report", e);
      return ReportException.EXIT_INTERNAL;
    }
  }

  private byte[] renderCsv(UsageReport report, Path path) {
    var out = new ByteArrayOutputStream();
    try {
      renderingService.writeCsv(report, out);
    } catch (IOException e) {
      throw new ReportOutputException(path, e);
    }
    return out.toByteArray();
  }

  /** Writes every artifact, or none: files written before a failure are removed again. */
  private static void writeAll(Map<Path, byte[]> artifacts) {
    var written = new ArrayList<Path>();
    try {
      for (var artifact : artifacts.entrySet()) {
        write(artifact.getKey(), artifact.getValue());
        written.add(artifact.getKey());
      }
    } catch (ReportOutputException e) {
      written.forEach(UsageReportCommand::deleteWritten);
      throw e;
    }
    artifacts.forEach((path, content) -> log.info("Wrote {} ({} bytes)", path, content.length));
  }

  private static void deleteWritten(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Could not remove partially written report {}: {}", path, e.getMessage());
    }
  }

  private static void write(Path path, byte[] content) {
    try {
      var parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.write(path, content);
    } catch (IOException e) {
      throw new ReportOutputException(path, e);
    }
  }

  static Path sibling(Path pdfPath, String extension) {
    String fileName = pdfPath.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    String base = dot > 0 ? fileName.substring(0, dot) : fileName;
    return pdfPath.resolveSibling(base + "." + extension);
  }
}
