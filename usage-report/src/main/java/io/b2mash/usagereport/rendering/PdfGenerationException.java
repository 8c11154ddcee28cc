package io.b2mash.usagereport.rendering;

import io.b2mash.usagereport.exception.ReportException;

/** Thrown when PDF generation fails due to rendering or I/O errors. */
public class PdfGenerationException extends ReportException {

  public PdfGenerationException(String detail, Throwable cause) {
    super("PDF generation failed", detail, EXIT_INTERNAL, cause);
  }
}
