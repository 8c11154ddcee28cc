package io.b2mash.usagereport.integration.accounting;

/** Thrown by an {@link AccountingSource} when a usage query fails or returns unparseable data. */
public class AccountingQueryException extends Exception {

  public AccountingQueryException(String message) {
    super(message);
  }

  public AccountingQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
