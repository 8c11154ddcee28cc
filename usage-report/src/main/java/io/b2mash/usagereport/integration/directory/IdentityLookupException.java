package io.b2mash.usagereport.integration.directory;

/** Thrown by an {@link IdentityDirectory} when a query cannot be answered. */
public class IdentityLookupException extends Exception {

  public IdentityLookupException(String message) {
    super(message);
  }

  public IdentityLookupException(String message, Throwable cause) {
    super(message, cause);
  }
}
