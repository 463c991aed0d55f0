package io.replicheck.replication.model;

/**
 * Graded health of a namespace. The code follows the Nagios/Sensu exit-status convention.
 */
public enum HealthStatus {
  OK(0),
  WARNING(1),
  CRITICAL(2);

  private final int code;

  HealthStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
