package io.b2mash.usagereport.enrichment;

/**
 * Outcome of one enrichment sub-lookup: either the value the source returned, or a default
 * together with the reason the source could not supply it.
 *
 * @param value the looked-up value or the default; never null
 * @param failureReason why the default was used, null when the lookup succeeded
 */
public record LookupResult<T>(T value, String failureReason) {

  public static <T> LookupResult<T> found(T value) {
    return new LookupResult<>(value, null);
  }

  public static <T> LookupResult<T> defaulted(T defaultValue, String failureReason) {
    return new LookupResult<>(defaultValue, failureReason);
  }

  public boolean isDefaulted() {
    return failureReason != null;
  }
}
