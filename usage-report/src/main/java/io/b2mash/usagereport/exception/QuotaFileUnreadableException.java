package io.b2mash.usagereport.exception;

import java.nio.file.Path;

public class QuotaFileUnreadableException extends ReportException {

  public QuotaFileUnreadableException(Path path, Throwable cause) {
    super("Quota file unreadable", "Cannot read quota report " + path, EXIT_FATAL, cause);
  }
}
