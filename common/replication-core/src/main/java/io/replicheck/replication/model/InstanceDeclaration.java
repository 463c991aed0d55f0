package io.replicheck.replication.model;

import java.util.Objects;

/**
 * One orchestrator instance definition of a service.
 *
 * @param service           owning service
 * @param instance          instance name
 * @param declaredNamespace namespace the instance registers under, or {@code null} to use
 *                          the instance name
 * @param instanceCount     number of tasks the orchestrator keeps running
 */
public record InstanceDeclaration(
    String service,
    String instance,
    String declaredNamespace,
    int instanceCount
) {

  public InstanceDeclaration {
    Objects.requireNonNull(service, "service");
    Objects.requireNonNull(instance, "instance");
    if (instanceCount < 0) {
      throw new IllegalArgumentException(
          "instanceCount must not be negative for " + service + "/" + instance + ": " + instanceCount);
    }
  }

  public String effectiveNamespace() {
    return declaredNamespace != null ? declaredNamespace : instance;
  }

  public boolean resolvesTo(NamespaceId id) {
    return service.equals(id.service()) && effectiveNamespace().equals(id.namespace());
  }
}
