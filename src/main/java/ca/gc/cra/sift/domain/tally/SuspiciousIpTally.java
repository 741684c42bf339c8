package ca.gc.cra.sift.domain.tally;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * <strong>What:</strong> Mapping from IP address text to a non-negative occurrence count.
 * <p><strong>Role:</strong> Value returned by every worker rank and merged by the root.</p>
 * <p><strong>Thread-safety:</strong> Immutable; build instances with {@link Builder}, which is not
 * thread-safe and is meant to be confined to a single worker.</p>
 *
 * @since 0.1.0
 */
public final class SuspiciousIpTally {
  private static final SuspiciousIpTally EMPTY = new SuspiciousIpTally(Map.of());

  private static final Comparator<Map.Entry<String, Long>> RANKING =
      Map.Entry.<String, Long>comparingByValue()
          .reversed()
          .thenComparing(Map.Entry.<String, Long>comparingByKey());

  private final Map<String, Long> counts;

  private SuspiciousIpTally(Map<String, Long> counts) {
    this.counts = counts;
  }

  /**
   * Returns the empty tally.
   *
   * @return shared empty instance
   */
  public static SuspiciousIpTally empty() {
    return EMPTY;
  }

  /**
   * Copies a map of counts into a tally.
   *
   * @param counts address to count; counts must be non-negative
   * @return immutable tally
   * @throws IllegalArgumentException if a count is negative
   */
  public static SuspiciousIpTally of(Map<String, Long> counts) {
    Builder builder = builder();
    Objects.requireNonNull(counts, "counts").forEach(builder::add);
    return builder.build();
  }

  /**
   * Creates a mutable builder.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Sums counts per key across all tallies. The result does not depend on iteration order.
   *
   * @param tallies tallies to merge; must not be {@code null}
   * @return merged tally
   */
  public static SuspiciousIpTally mergeAll(Collection<SuspiciousIpTally> tallies) {
    Builder builder = builder();
    for (SuspiciousIpTally tally : Objects.requireNonNull(tallies, "tallies")) {
      tally.counts.forEach(builder::add);
    }
    return builder.build();
  }

  /**
   * Keeps only entries accepted by {@code predicate}.
   *
   * @param predicate receives the address and its count
   * @return filtered tally
   */
  public SuspiciousIpTally filter(BiPredicate<String, Long> predicate) {
    Builder builder = builder();
    counts.forEach((ip, count) -> {
      if (predicate.test(ip, count)) {
        builder.add(ip, count);
      }
    });
    return builder.build();
  }

  public boolean isEmpty() {
    return counts.isEmpty();
  }

  public int size() {
    return counts.size();
  }

  /**
   * Returns the count for {@code ip}, zero when absent.
   *
   * @param ip address text
   * @return occurrence count
   */
  public long count(String ip) {
    return counts.getOrDefault(ip, 0L);
  }

  /**
   * Returns an unmodifiable view of the counts, unordered.
   *
   * @return address to count
   */
  public Map<String, Long> asMap() {
    return counts;
  }

  /**
   * Returns the counts ranked by descending count, ties broken by address text.
   *
   * @return insertion-ordered copy in ranking order
   */
  public Map<String, Long> ranked() {
    Map<String, Long> ordered = new LinkedHashMap<>();
    counts.entrySet().stream().sorted(RANKING).forEach(e -> ordered.put(e.getKey(), e.getValue()));
    return ordered;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof SuspiciousIpTally that && counts.equals(that.counts);
  }

  @Override
  public int hashCode() {
    return counts.hashCode();
  }

  @Override
  public String toString() {
    return "SuspiciousIpTally" + ranked();
  }

  /**
   * Single-owner accumulator for a tally.
   */
  public static final class Builder {
    private final Map<String, Long> counts = new HashMap<>();

    private Builder() {}

    /**
     * Adds one occurrence of {@code ip}.
     *
     * @param ip address text
     * @return this builder
     */
    public Builder increment(String ip) {
      return add(ip, 1L);
    }

    /**
     * Adds {@code count} occurrences of {@code ip}.
     *
     * @param ip address text; must not be {@code null}
     * @param count occurrences to add; must be non-negative
     * @return this builder
     */
    public Builder add(String ip, long count) {
      Objects.requireNonNull(ip, "ip");
      if (count < 0) {
        throw new IllegalArgumentException("count must be >= 0 for " + ip);
      }
      counts.merge(ip, count, Long::sum);
      return this;
    }

    public boolean isEmpty() {
      return counts.isEmpty();
    }

    /**
     * Produces an immutable tally from the accumulated counts.
     *
     * @return tally snapshot
     */
    public SuspiciousIpTally build() {
      return counts.isEmpty() ? EMPTY : new SuspiciousIpTally(Map.copyOf(counts));
    }
  }
}
