package io.replicheck.replication.model;

/**
 * Raised when an encoded namespace id cannot be split into a service and a namespace.
 */
public class MalformedNamespaceIdException extends IllegalArgumentException {

  public MalformedNamespaceIdException(String encoded, String reason) {
    super("Malformed namespace id '" + encoded + "': " + reason);
  }
}
