package io.replicheck.replication.runtime;

import io.replicheck.replication.model.HealthStatus;
import io.replicheck.replication.model.NamespaceId;
import io.replicheck.replication.model.Thresholds;
import io.replicheck.replication.model.Verdict;
import java.util.Objects;

/**
 * Maps expected and available backend counts to a {@link Verdict}.
 * <p>
 * Both thresholds are inclusive: a ratio equal to the critical percentage is CRITICAL, a
 * ratio equal to the warning percentage (and above critical) is WARNING.
 */
public final class ThresholdEvaluator {

  public Verdict evaluate(NamespaceId id, int expected, int available, Thresholds thresholds) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(thresholds, "thresholds");
    if (expected <= 0) {
      throw new IllegalArgumentException("expected must be positive for " + id + ": " + expected);
    }
    if (available < 0) {
      throw new IllegalArgumentException("available must not be negative for " + id + ": " + available);
    }
    // scaled before dividing so exact boundaries such as 9/10 == 90 compare equal
    double ratio = (available * 100.0) / expected;
    String message = String.format(
        "Service namespace %s has %d/%d instances available, thresholds are WARN @ %d, CRITICAL @ %d",
        id.encode(),
        available,
        expected,
        thresholds.warnPercent(),
        thresholds.critPercent());
    return new Verdict(classify(ratio, thresholds), ratio, message);
  }

  public Verdict noData(NamespaceId id) {
    Objects.requireNonNull(id, "id");
    return new Verdict(
        HealthStatus.CRITICAL,
        0.0,
        "Service namespace entry " + id.encode() + " not found! No instances available!");
  }

  static HealthStatus classify(double ratio, Thresholds thresholds) {
    if (ratio <= thresholds.critPercent()) {
      return HealthStatus.CRITICAL;
    }
    if (ratio <= thresholds.warnPercent()) {
      return HealthStatus.WARNING;
    }
    return HealthStatus.OK;
  }
}
