package io.b2mash.usagereport.exception;

import java.nio.file.Path;

/** Thrown when the quota report does not match the expected fixed column layout. */
public class QuotaFileMalformedException extends ReportException {

  private final int lineNumber;

  public QuotaFileMalformedException(Path path, int lineNumber, String reason) {
    super(
        "Quota file malformed",
        lineNumber > 0
            ? "Quota report " + path + " line " + lineNumber + ": " + reason
            : "Quota report " + path + ": " + reason,
        EXIT_FATAL,
        null);
    this.lineNumber = lineNumber;
  }

  public int getLineNumber() {
    return lineNumber;
  }
}
