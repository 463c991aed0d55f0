package io.replicheck.replication.model;

import java.util.Objects;

/**
 * A single alert handed to the transport.
 *
 * @param checkId stable check name derived from the namespace
 * @param status  severity to report
 * @param output  explanation text
 * @param route   routing metadata of the owning service
 */
public record AlertEvent(String checkId, HealthStatus status, String output, AlertRoute route) {

  public AlertEvent {
    Objects.requireNonNull(checkId, "checkId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(output, "output");
    Objects.requireNonNull(route, "route");
  }

  public String runbook() {
    return route.runbook();
  }
}
