package io.replicheck.replication.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything the configuration store could (and could not) read for a single run.
 *
 * @param declarations well-formed instance declarations
 * @param faults       entries that failed structurally
 * @param services     services whose configuration was discoverable at all
 */
public record DeclarationSnapshot(
    List<InstanceDeclaration> declarations,
    List<DeclarationFault> faults,
    Set<String> services
) {

  public DeclarationSnapshot {
    declarations = List.copyOf(Objects.requireNonNull(declarations, "declarations"));
    faults = List.copyOf(Objects.requireNonNull(faults, "faults"));
    services = Set.copyOf(Objects.requireNonNull(services, "services"));
  }

  public static DeclarationSnapshot empty() {
    return new DeclarationSnapshot(List.of(), List.of(), Set.of());
  }

  public boolean hasService(String service) {
    return services.contains(service);
  }
}
