package io.b2mash.usagereport.summary;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/** Bounded top-N ranking with an "All Others" rollup bucket. */
public final class TopNRanker {

  private TopNRanker() {}

  /**
   * Ranks {@code pool} by {@code metric}, highest first. Equal values keep their order in {@code
   * pool}. When the pool holds more than {@code n} items, the first {@code n} are followed by one
   * rollup entry whose value is the sum of the rest; otherwise every item is returned and no rollup
   * is added.
   */
  public static <T> List<RankedEntry> rank(
      List<T> pool, ToDoubleFunction<T> metric, Function<T, String> label, int n) {
    if (n < 1) {
      throw new IllegalArgumentException("n must be at least 1, was " + n);
    }
    var sorted = new ArrayList<>(pool);
    sorted.sort(Comparator.comparingDouble(metric).reversed());

    var ranked = new ArrayList<RankedEntry>(Math.min(sorted.size(), n) + 1);
    double othersTotal = 0.0;
    for (int i = 0; i < sorted.size(); i++) {
      var item = sorted.get(i);
      if (i < n) {
        ranked.add(RankedEntry.of(label.apply(item), metric.applyAsDouble(item)));
      } else {
        othersTotal += metric.applyAsDouble(item);
      }
    }
    if (sorted.size() > n) {
      ranked.add(RankedEntry.allOthers(othersTotal));
    }
    return List.copyOf(ranked);
  }
}
