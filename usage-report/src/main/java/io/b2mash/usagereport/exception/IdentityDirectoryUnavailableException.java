package io.b2mash.usagereport.exception;

/** Thrown when group membership cannot be resolved because the directory itself failed. */
public class IdentityDirectoryUnavailableException extends ReportException {

  public IdentityDirectoryUnavailableException(String detail, Throwable cause) {
    super("Identity directory unavailable", detail, EXIT_FATAL, cause);
  }
}
