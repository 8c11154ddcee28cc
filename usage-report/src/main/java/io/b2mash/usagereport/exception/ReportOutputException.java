package io.b2mash.usagereport.exception;

import java.nio.file.Path;

/** Thrown when a rendered report cannot be written to its destination. */
public class ReportOutputException extends ReportException {

  public ReportOutputException(Path path, Throwable cause) {
    super("Report output failed", "Cannot write report to " + path, EXIT_INTERNAL, cause);
  }
}
