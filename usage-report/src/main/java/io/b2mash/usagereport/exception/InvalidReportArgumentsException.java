package io.b2mash.usagereport.exception;

public class InvalidReportArgumentsException extends ReportException {

  public InvalidReportArgumentsException(String detail) {
    super("Invalid arguments", detail, EXIT_USAGE, null);
  }

  public InvalidReportArgumentsException(String detail, Throwable cause) {
    super("Invalid arguments", detail, EXIT_USAGE, cause);
  }
}
