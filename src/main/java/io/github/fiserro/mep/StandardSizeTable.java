package io.github.fiserro.mep;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

/**
 * Ordered ladder of standard sizes (duct diameters, wire gauges, pipe diameters, breaker ratings).
 *
 * <p>Each entry pairs a numeric threshold with a label. Thresholds are strictly increasing. When
 * no entry satisfies a selection the largest entry is returned; a ladder never signals "out of
 * range".
 *
 * @param entries the ladder entries in ascending threshold order
 * @param <L> the label type
 */
public record StandardSizeTable<L>(List<Entry<L>> entries) {

  /**
   * A single rung of the ladder.
   *
   * @param threshold the value the rung can carry (capacity, ampacity, diameter)
   * @param label     the size reported when this rung is selected
   */
  public record Entry<L>(double threshold, L label) {
  }

  public StandardSizeTable {
    if (entries == null || entries.isEmpty()) {
      throw new IllegalArgumentException("Size table must contain at least one entry");
    }
    entries = ImmutableList.copyOf(entries);
    for (int i = 1; i < entries.size(); i++) {
      if (!(entries.get(i).threshold() > entries.get(i - 1).threshold())) {
        throw new IllegalArgumentException("Size table thresholds must be strictly increasing, got "
            + entries.get(i - 1).threshold() + " followed by " + entries.get(i).threshold());
      }
    }
  }

  public static <L> Entry<L> entry(double threshold, L label) {
    return new Entry<>(threshold, label);
  }

  @SafeVarargs
  public static <L> StandardSizeTable<L> of(Entry<L>... entries) {
    return new StandardSizeTable<>(Arrays.asList(entries));
  }

  /** Ladder whose labels are the sizes themselves. */
  public static StandardSizeTable<Double> ofSizes(double... sizes) {
    return new StandardSizeTable<>(Arrays.stream(sizes)
        .mapToObj(size -> entry(size, size))
        .toList());
  }

  /** Ladder of integer sizes whose labels are the sizes themselves. */
  public static StandardSizeTable<Integer> ofSizes(int... sizes) {
    return new StandardSizeTable<>(Arrays.stream(sizes)
        .mapToObj(size -> entry(size, size))
        .toList());
  }

  /** First entry whose threshold is at least {@code requirement}, else the largest entry. */
  public L atLeast(double requirement) {
    for (Entry<L> entry : entries) {
      if (entry.threshold() >= requirement) {
        return entry.label();
      }
    }
    return largest();
  }

  /** First entry whose threshold is strictly greater than {@code value}, else the largest entry. */
  public L above(double value) {
    for (Entry<L> entry : entries) {
      if (entry.threshold() > value) {
        return entry.label();
      }
    }
    return largest();
  }

  /** Entry whose threshold is nearest to {@code value}; ties go to the smaller entry. */
  public L closest(double value) {
    Entry<L> best = entries.get(0);
    for (Entry<L> entry : entries) {
      if (Math.abs(entry.threshold() - value) < Math.abs(best.threshold() - value)) {
        best = entry;
      }
    }
    return best.label();
  }

  /**
   * The entry one step above the given label. The largest entry maps to itself, as does a label
   * that is not in the ladder.
   */
  public L nextLarger(L label) {
    for (int i = 0; i < entries.size() - 1; i++) {
      if (entries.get(i).label().equals(label)) {
        return entries.get(i + 1).label();
      }
    }
    return label;
  }

  L smallest() {
    return entries.get(0).label();
  }

  public L largest() {
    return entries.get(entries.size() - 1).label();
  }

  List<L> labels() {
    return entries.stream().map(Entry::label).toList();
  }

  boolean contains(L label) {
    return entries.stream().anyMatch(entry -> entry.label().equals(label));
  }
}
