package io.b2mash.usagereport.exception;

/**
 * Base class for errors that abort report generation. Carries a short title, a human-readable
 * detail and the process exit code the command line maps it to.
 */
public abstract class ReportException extends RuntimeException {

  public static final int EXIT_FATAL = 1;
  public static final int EXIT_USAGE = 2;
  public static final int EXIT_INTERNAL = 3;

  private final String title;
  private final int exitCode;

  protected ReportException(String title, String detail, int exitCode, Throwable cause) {
    super(detail, cause);
    this.title = title;
    this.exitCode = exitCode;
  }

  public String getTitle() {
    return title;
  }

  public String getDetail() {
    return getMessage();
  }

  public int getExitCode() {
    return exitCode;
  }
}
