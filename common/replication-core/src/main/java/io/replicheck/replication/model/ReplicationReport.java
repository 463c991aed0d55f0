package io.replicheck.replication.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcomes of one run, in the order of the namespace universe.
 */
public record ReplicationReport(List<NamespaceOutcome> outcomes) {

  public ReplicationReport {
    outcomes = List.copyOf(Objects.requireNonNull(outcomes, "outcomes"));
  }

  public Optional<NamespaceOutcome> find(NamespaceId id) {
    return outcomes.stream().filter(o -> o.namespace().equals(id)).findFirst();
  }

  public long count(OutcomeState state) {
    return outcomes.stream().filter(o -> o.state() == state).count();
  }

  public long count(HealthStatus status) {
    return outcomes.stream().filter(o -> o.status().orElse(null) == status).count();
  }

  public long count(Delivery delivery) {
    return outcomes.stream().filter(o -> o.delivery() == delivery).count();
  }

  public int size() {
    return outcomes.size();
  }
}
