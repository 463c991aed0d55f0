package io.replicheck.replication.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Immutable snapshot of available backend counts keyed by namespace.
 * <p>
 * A namespace that discovery never reported is absent, which is distinct from a
 * namespace reported with zero healthy backends.
 */
public final class AvailabilityMap {

  private static final AvailabilityMap EMPTY = new AvailabilityMap(Map.of());

  private final Map<NamespaceId, Integer> counts;

  private AvailabilityMap(Map<NamespaceId, Integer> counts) {
    this.counts = counts;
  }

  public static AvailabilityMap empty() {
    return EMPTY;
  }

  public static AvailabilityMap of(Map<NamespaceId, Integer> counts) {
    Objects.requireNonNull(counts, "counts");
    Map<NamespaceId, Integer> copy = new LinkedHashMap<>();
    counts.forEach((id, count) -> copy.put(Objects.requireNonNull(id, "namespace"), requireCount(id, count)));
    return new AvailabilityMap(Map.copyOf(copy));
  }

  /**
   * Builds a map from {@code service.namespace} keys.
   *
   * @throws MalformedNamespaceIdException if any key cannot be parsed
   */
  public static AvailabilityMap fromEncoded(Map<String, Integer> counts) {
    Objects.requireNonNull(counts, "counts");
    Map<NamespaceId, Integer> parsed = new LinkedHashMap<>();
    counts.forEach((key, count) -> parsed.put(NamespaceId.parse(key), count));
    return of(parsed);
  }

  public OptionalInt availableFor(NamespaceId id) {
    Integer count = counts.get(id);
    return count == null ? OptionalInt.empty() : OptionalInt.of(count);
  }

  public int size() {
    return counts.size();
  }

  private static int requireCount(NamespaceId id, Integer count) {
    if (count == null || count < 0) {
      throw new IllegalArgumentException("available count for " + id + " must be non-negative: " + count);
    }
    return count;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof AvailabilityMap other && counts.equals(other.counts);
  }

  @Override
  public int hashCode() {
    return counts.hashCode();
  }

  @Override
  public String toString() {
    return "AvailabilityMap" + counts;
  }
}
