package io.replicheck.replication.model;

import java.util.Objects;

/**
 * A declaration (or a whole service configuration) that could not be read.
 *
 * @param service       owning service
 * @param instance      broken instance, or {@code null} when the whole service failed
 * @param namespaceHint namespace the entry would have resolved to, or {@code null} if unknown
 * @param reason        human readable cause
 */
public record DeclarationFault(String service, String instance, String namespaceHint, String reason) {

  public DeclarationFault {
    Objects.requireNonNull(service, "service");
    reason = reason == null ? "unknown" : reason;
  }

  public static DeclarationFault serviceWide(String service, String reason) {
    return new DeclarationFault(service, null, null, reason);
  }

  /**
   * Whether this fault may hide a declaration belonging to the given namespace.
   */
  public boolean mayAffect(NamespaceId id) {
    if (!service.equals(id.service())) {
      return false;
    }
    return namespaceHint == null || namespaceHint.equals(id.namespace());
  }
}
