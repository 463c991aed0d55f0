package io.replicheck.replication.ports;

/**
 * One of the inputs of a run (namespaces, declarations, availability) could not be
 * obtained. The run produces no outcomes.
 */
public class SnapshotUnavailableException extends RuntimeException {

  private final String snapshot;

  public SnapshotUnavailableException(String snapshot, Throwable cause) {
    super("Unable to obtain " + snapshot + " snapshot: " + describe(cause), cause);
    this.snapshot = snapshot;
  }

  public String snapshot() {
    return snapshot;
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown cause";
    }
    return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
  }
}
