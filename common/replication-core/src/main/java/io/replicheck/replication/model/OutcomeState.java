package io.replicheck.replication.model;

/**
 * Terminal state of one namespace within one run.
 */
public enum OutcomeState {
  /** Owning configuration missing or unreadable. */
  SKIPPED_NOT_MANAGED,
  /** No instances declared for this cluster. */
  SKIPPED_NOT_IN_SCOPE,
  /** Expected instances but discovery has no entry. */
  NO_DATA,
  EVALUATED;

  public boolean isSkipped() {
    return this == SKIPPED_NOT_MANAGED || this == SKIPPED_NOT_IN_SCOPE;
  }
}
