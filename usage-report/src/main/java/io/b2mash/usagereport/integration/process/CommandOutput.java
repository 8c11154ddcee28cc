package io.b2mash.usagereport.integration.process;

import java.util.List;

/** Captured result of an external command that ran to completion. */
public record CommandOutput(int exitCode, List<String> stdoutLines, String stderr) {

  public CommandOutput {
    stdoutLines = List.copyOf(stdoutLines);
    stderr = stderr == null ? "" : stderr;
  }

  public boolean isSuccess() {
    return exitCode == 0;
  }
}
