package io.b2mash.usagereport.integration.accounting;

import io.b2mash.usagereport.config.UsageReportProperties;
import io.b2mash.usagereport.integration.process.CommandExecutionException;
import io.b2mash.usagereport.integration.process.OsCommandRunner;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link AccountingSource} backed by Slurm's {@code sacct}. Each query runs {@code sacct -X -n
 * --format=CPUTimeRaw}, which prints one allocation-level CPU time per line with no header.
 */
@Component
public class SacctAccountingSource implements AccountingSource {

  private static final Logger log = LoggerFactory.getLogger(SacctAccountingSource.class);

  private final OsCommandRunner commandRunner;
  private final String sacctCommand;
  private final String jobStates;

  public SacctAccountingSource(OsCommandRunner commandRunner, UsageReportProperties properties) {
    this.commandRunner = commandRunner;
    this.sacctCommand = properties.accounting().sacctCommand();
    this.jobStates = properties.accounting().jobStates();
  }

  @Override
  public List<Long> completedJobCpuSeconds(
      String username, String partition, LocalDate start, LocalDate end)
      throws AccountingQueryException {
    var command = buildCommand(username, partition, start, end);

    try {
      var output = commandRunner.run(command);
      if (!output.isSuccess()) {
        throw new AccountingQueryException(
            "sacct exited with status " + output.exitCode() + ": " + output.stderr());
      }
      var cpuSeconds = parseCpuTimes(output.stdoutLines());
      log.debug(
          "sacct user={} partition={} returned {} job(s)", username, partition, cpuSeconds.size());
      return cpuSeconds;
    } catch (CommandExecutionException e) {
      throw new AccountingQueryException(e.getMessage(), e);
    }
  }

  List<String> buildCommand(String username, String partition, LocalDate start, LocalDate end) {
    var command = new ArrayList<String>();
    command.add(sacctCommand);
    command.add("-u");
    command.add(username);
    command.add("-S");
    command.add(start.format(DateTimeFormatter.ISO_LOCAL_DATE));
    command.add("-E");
    command.add(end.format(DateTimeFormatter.ISO_LOCAL_DATE));
    command.add("-r");
    command.add(partition);
    command.add("-X");
    command.add("-n");
    command.add("--format=CPUTimeRaw");
    if (jobStates != null && !jobStates.isBlank()) {
      command.add("--state=" + jobStates);
    }
    return command;
  }

  static List<Long> parseCpuTimes(List<String> lines) throws AccountingQueryException {
    var cpuSeconds = new ArrayList<Long>(lines.size());
    for (String line : lines) {
      String value = line.trim();
      if (value.isEmpty()) {
        continue;
      }
      try {
        long seconds = Long.parseLong(value);
        if (seconds < 0) {
          throw new AccountingQueryException("Negative CPU time from sacct: " + value);
        }
        cpuSeconds.add(seconds);
      } catch (NumberFormatException e) {
        throw new AccountingQueryException("Unexpected sacct output line: " + value, e);
      }
    }
    return cpuSeconds;
  }
}
