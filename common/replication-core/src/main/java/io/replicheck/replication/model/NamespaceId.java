package io.replicheck.replication.model;

import java.util.Objects;

/**
 * Compound key of an owning service and one of its discovery namespaces.
 * <p>
 * Encoded as {@code service.namespace}. Neither component may contain the separator, so
 * an encoded id always splits back into exactly the two parts it was built from.
 */
public record NamespaceId(String service, String namespace) implements Comparable<NamespaceId> {

  public static final String SEPARATOR = ".";

  public NamespaceId {
    service = requireComponent(service, "service");
    namespace = requireComponent(namespace, "namespace");
  }

  public static NamespaceId of(String service, String namespace) {
    return new NamespaceId(service, namespace);
  }

  /**
   * Splits an encoded {@code service.namespace} id.
   *
   * @throws MalformedNamespaceIdException if the value does not hold exactly two non-empty parts
   */
  public static NamespaceId parse(String encoded) {
    if (encoded == null || encoded.isBlank()) {
      throw new MalformedNamespaceIdException(encoded, "id must not be blank");
    }
    int idx = encoded.indexOf(SEPARATOR);
    if (idx < 0) {
      throw new MalformedNamespaceIdException(encoded, "missing separator '" + SEPARATOR + "'");
    }
    if (encoded.indexOf(SEPARATOR, idx + SEPARATOR.length()) >= 0) {
      throw new MalformedNamespaceIdException(encoded, "more than one separator '" + SEPARATOR + "'");
    }
    String service = encoded.substring(0, idx);
    String namespace = encoded.substring(idx + SEPARATOR.length());
    if (service.isEmpty() || namespace.isEmpty()) {
      throw new MalformedNamespaceIdException(encoded, "service and namespace must both be present");
    }
    return new NamespaceId(service, namespace);
  }

  public String encode() {
    return service + SEPARATOR + namespace;
  }

  @Override
  public int compareTo(NamespaceId other) {
    int byService = service.compareTo(other.service);
    return byService != 0 ? byService : namespace.compareTo(other.namespace);
  }

  @Override
  public String toString() {
    return encode();
  }

  private static String requireComponent(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isEmpty()) {
      throw new IllegalArgumentException(name + " must not be empty");
    }
    if (value.contains(SEPARATOR)) {
      throw new IllegalArgumentException(
          name + " '" + value + "' must not contain separator '" + SEPARATOR + "'");
    }
    return value;
  }
}
