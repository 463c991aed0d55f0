package io.replicheck.replication.model;

/**
 * Result of resolving the expected instance count of a namespace: either a count or
 * an explanation of why the namespace is not managed by the orchestrator.
 */
public record ExpectedCount(boolean managed, int count, String reason) {

  public ExpectedCount {
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative: " + count);
    }
  }

  public static ExpectedCount resolved(int count) {
    return new ExpectedCount(true, count, null);
  }

  public static ExpectedCount unmanaged(String reason) {
    return new ExpectedCount(false, 0, reason);
  }
}
