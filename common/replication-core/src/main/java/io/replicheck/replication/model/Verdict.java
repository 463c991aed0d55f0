package io.replicheck.replication.model;

import java.util.Objects;

/**
 * Result of comparing available against expected backends.
 *
 * @param status  graded classification
 * @param ratio   available / expected * 100; zero when no availability data exists
 * @param message human readable explanation sent along with the alert
 */
public record Verdict(HealthStatus status, double ratio, String message) {

  public Verdict {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(message, "message");
  }
}
