package io.b2mash.usagereport.integration.process;

/** Thrown when an external command cannot be started, times out, or is interrupted. */
public class CommandExecutionException extends Exception {

  public CommandExecutionException(String message) {
    super(message);
  }

  public CommandExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
