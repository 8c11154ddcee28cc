package io.b2mash.usagereport.cli;

import io.b2mash.usagereport.exception.InvalidReportArgumentsException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;

/**
 * Command line of a report run: {@code <group> -S <YYYY-MM-DD> -E <YYYY-MM-DD> [--quota-file=PATH]
 * [--output=PATH] [--csv] [--html]}.
 *
 * <p>Other {@code --name=value} options are left to Spring Boot, which reads them as configuration
 * properties.
 *
 * @param quotaFile explicit quota report, or null to derive it from the configured pattern
 * @param output explicit PDF destination, or null to use the configured output directory
 */
public record ReportArguments(
    String groupName,
    LocalDate start,
    LocalDate end,
    Path quotaFile,
    Path output,
    boolean csv,
    boolean html) {

  public static final String USAGE =
      "usage: report <group> -S <YYYY-MM-DD> -E <YYYY-MM-DD>"
          + " [--quota-file=PATH] [--output=PATH] [--csv] [--html]";

  public static ReportArguments parse(String... args) {
    var positional = new ArrayList<String>();
    String start = null;
    String end = null;
    Path quotaFile = null;
    Path output = null;
    boolean csv = false;
    boolean html = false;

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      switch (arg) {
        case "-S" -> start = requireValue(args, ++i, "-S");
        case "-E" -> end = requireValue(args, ++i, "-E");
        case "--csv" -> csv = true;
        case "--html" -> html = true;
        default -> {
          if (arg.startsWith("--start=")) {
            start = valueOf(arg);
          } else if (arg.startsWith("--end=")) {
            end = valueOf(arg);
          } else if (arg.startsWith("--quota-file=")) {
            quotaFile = Path.of(valueOf(arg));
          } else if (arg.startsWith("--output=")) {
            output = Path.of(valueOf(arg));
          } else if (arg.startsWith("--")) {
            // configuration property override, handled by Spring Boot
          } else if (arg.startsWith("-") && arg.length() > 1) {
            throw new InvalidReportArgumentsException("Unknown option " + arg + "\n" + USAGE);
          } else {
            positional.add(arg);
          }
        }
      }
    }

    if (positional.size() != 1) {
      throw new InvalidReportArgumentsException(
          (positional.isEmpty() ? "Missing group name" : "Expected one group, got " + positional)
              + "\n"
              + USAGE);
    }
    var startDate = parseDate(start, "-S");
    var endDate = parseDate(end, "-E");
    if (startDate.isAfter(endDate)) {
      throw new InvalidReportArgumentsException(
          "Start date " + startDate + " is after end date " + endDate);
    }
    return new ReportArguments(
        positional.get(0), startDate, endDate, quotaFile, output, csv, html);
  }

  private static String requireValue(String[] args, int index, String option) {
    if (index >= args.length) {
      throw new InvalidReportArgumentsException("Option " + option + " needs a value\n" + USAGE);
    }
    return args[index];
  }

  private static String valueOf(String option) {
    return option.substring(option.indexOf('=') + 1);
  }

  private static LocalDate parseDate(String value, String option) {
    if (value == null) {
      throw new InvalidReportArgumentsException("Missing " + option + " date\n" + USAGE);
    }
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException e) {
      throw new InvalidReportArgumentsException(
          "Invalid " + option + " date '" + value + "', expected YYYY-MM-DD", e);
    }
  }
}
