package io.b2mash.usagereport.storage;

import io.b2mash.usagereport.config.UsageReportProperties;
import io.b2mash.usagereport.exception.QuotaFileMalformedException;
import io.b2mash.usagereport.exception.QuotaFileUnreadableException;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Parses a group quota report.
 *
 * <p>The report is whitespace-delimited. After a fixed number of header lines the first data row
 * is the group aggregate and every following row is one user. Columns are username, parent path,
 * type, GB used, GB available, GB hard limit, grace period, then the file-count equivalents; only
 * username, GB used and (for the aggregate) GB available are read.
 */
@Component
public class QuotaReportLoader {

  private static final Logger log = LoggerFactory.getLogger(QuotaReportLoader.class);

  private static final int USERNAME_COLUMN = 0;
  private static final int USED_GB_COLUMN = 3;
  private static final int AVAILABLE_GB_COLUMN = 4;

  private final int headerLines;

  public QuotaReportLoader(UsageReportProperties properties) {
    this.headerLines = properties.quota().headerLines();
  }

  public QuotaSnapshot load(Path path) {
    List<String> lines;
    try {
      lines = Files.readAllLines(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new QuotaFileUnreadableException(path, e);
    }

    Long totalUsed = null;
    long totalAvailable = 0;
    var storageByUser = new LinkedHashMap<String, Long>();

    for (int i = headerLines; i < lines.size(); i++) {
      String line = lines.get(i).trim();
      if (line.isEmpty()) {
        continue;
      }
      int lineNumber = i + 1;
      String[] columns = line.split("\\s+");

      if (totalUsed == null) {
        if (columns.length <= AVAILABLE_GB_COLUMN) {
          throw new QuotaFileMalformedException(
              path, lineNumber, "aggregate row has " + columns.length + " column(s)");
        }
        totalUsed = parseGigabytes(path, lineNumber, columns[USED_GB_COLUMN]);
        totalAvailable = parseGigabytes(path, lineNumber, columns[AVAILABLE_GB_COLUMN]);
        continue;
      }

      if (columns.length <= USED_GB_COLUMN) {
        throw new QuotaFileMalformedException(
            path, lineNumber, "user row has " + columns.length + " column(s)");
      }
      long used = parseGigabytes(path, lineNumber, columns[USED_GB_COLUMN]);
      storageByUser.merge(columns[USERNAME_COLUMN], used, Long::sum);
    }

    if (totalUsed == null) {
      throw new QuotaFileMalformedException(path, 0, "no group aggregate row");
    }

    log.info(
        "Loaded quota report {}: {} GB used, {} GB available, {} user row(s)",
        path,
        totalUsed,
        totalAvailable,
        storageByUser.size());
    return new QuotaSnapshot(totalUsed, totalAvailable, storageByUser);
  }

  private static long parseGigabytes(Path path, int lineNumber, String value) {
    try {
      var gigabytes = new BigDecimal(value);
      if (gigabytes.signum() < 0) {
        throw new QuotaFileMalformedException(path, lineNumber, "negative size " + value);
      }
      return gigabytes.setScale(0, RoundingMode.HALF_UP).longValueExact();
    } catch (NumberFormatException | ArithmeticException e) {
      throw new QuotaFileMalformedException(path, lineNumber, "non-numeric size " + value);
    }
  }
}
