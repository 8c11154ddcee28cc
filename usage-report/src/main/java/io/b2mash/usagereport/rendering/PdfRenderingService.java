package io.b2mash.usagereport.rendering;

import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Converts rendered XHTML into PDF bytes via OpenHTMLToPDF. */
@Service
public class PdfRenderingService {

  private static final Logger log = LoggerFactory.getLogger(PdfRenderingService.class);

  public byte[] htmlToPdf(String html) {
    try (var outputStream = new ByteArrayOutputStream()) {
      var builder = new PdfRendererBuilder();
      builder.useFastMode();
      builder.withHtmlContent(html, null);
      builder.toStream(outputStream);
      builder.run();
      log.debug("Rendered PDF of {} bytes", outputStream.size());
      return outputStream.toByteArray();
    } catch (IOException | RuntimeException e) {
      throw new PdfGenerationException("Failed to generate PDF from rendered HTML", e);
    }
  }
}
