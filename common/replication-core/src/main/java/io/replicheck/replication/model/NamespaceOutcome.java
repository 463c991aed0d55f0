package io.replicheck.replication.model;

import java.util.Objects;
import java.util.Optional;

/**
 * What happened to a single namespace during a run.
 *
 * @param namespace evaluated namespace
 * @param state     terminal state
 * @param verdict   verdict, {@code null} for skipped namespaces
 * @param delivery  fate of the alert event
 * @param detail    skip reason or delivery error, may be {@code null}
 */
public record NamespaceOutcome(
    NamespaceId namespace,
    OutcomeState state,
    Verdict verdict,
    Delivery delivery,
    String detail
) {

  public NamespaceOutcome {
    Objects.requireNonNull(namespace, "namespace");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(delivery, "delivery");
    if (state.isSkipped() && verdict != null) {
      throw new IllegalArgumentException("skipped outcome must not carry a verdict");
    }
    if (!state.isSkipped() && verdict == null) {
      throw new IllegalArgumentException("state " + state + " requires a verdict");
    }
  }

  public static NamespaceOutcome skipped(NamespaceId namespace, OutcomeState state, String detail) {
    return new NamespaceOutcome(namespace, state, null, Delivery.NOT_ATTEMPTED, detail);
  }

  public Optional<HealthStatus> status() {
    return verdict == null ? Optional.empty() : Optional.of(verdict.status());
  }
}
