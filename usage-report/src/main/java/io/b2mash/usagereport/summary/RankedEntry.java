package io.b2mash.usagereport.summary;

/**
 * One bar of a top-N chart.
 *
 * @param label username, or {@value #ALL_OTHERS} for the rollup bucket
 * @param value the ranked metric
 * @param rollup true for the synthesized bucket summing everything outside the top N
 */
public record RankedEntry(String label, double value, boolean rollup) {

  public static final String ALL_OTHERS = "All Others";

  public static RankedEntry of(String label, double value) {
    return new RankedEntry(label, value, false);
  }

  public static RankedEntry allOthers(double value) {
    return new RankedEntry(ALL_OTHERS, value, true);
  }
}
