package io.replicheck.replication.model;

import java.util.Objects;

/**
 * Where and how alerts for a service are delivered.
 * <p>
 * Services without a team have no route at all; see
 * {@link io.replicheck.replication.ports.AlertRoutePort}.
 */
public record AlertRoute(
    String team,
    String runbook,
    String tip,
    String notificationEmail,
    boolean page
) {

  public AlertRoute {
    Objects.requireNonNull(team, "team");
    if (team.isBlank()) {
      throw new IllegalArgumentException("team must not be blank");
    }
  }
}
