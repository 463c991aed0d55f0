package io.replicheck.replication.model;

/**
 * Percentages of available/expected at or below which a namespace is reported.
 * <p>
 * The two values are independent; nothing forces {@code critPercent <= warnPercent}.
 * When crit is above warn the WARNING band is empty and every shortfall at or below
 * crit is CRITICAL.
 */
public record Thresholds(int warnPercent, int critPercent) {

  public static final int DEFAULT_WARN_PERCENT = 75;
  public static final int DEFAULT_CRIT_PERCENT = 90;

  public Thresholds {
    if (warnPercent < 0) {
      throw new IllegalArgumentException("warnPercent must not be negative: " + warnPercent);
    }
    if (critPercent < 0) {
      throw new IllegalArgumentException("critPercent must not be negative: " + critPercent);
    }
  }

  public static Thresholds defaults() {
    return new Thresholds(DEFAULT_WARN_PERCENT, DEFAULT_CRIT_PERCENT);
  }

  public boolean isInverted() {
    return critPercent > warnPercent;
  }
}
