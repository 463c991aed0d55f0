package io.replicheck.replication.runtime;

import io.replicheck.replication.model.DeclarationFault;
import io.replicheck.replication.model.DeclarationSnapshot;
import io.replicheck.replication.model.ExpectedCount;
import io.replicheck.replication.model.InstanceDeclaration;
import io.replicheck.replication.model.NamespaceId;
import java.util.Objects;

/**
 * Sums declared instance counts per namespace.
 * <p>
 * A broken entry only poisons the namespaces it could have contributed to: a fault with
 * a namespace hint affects that namespace, a fault without one affects every namespace of
 * its service. Everything else keeps aggregating.
 */
public final class ExpectedInstanceAggregator {

  public ExpectedCount expectedCount(NamespaceId id, DeclarationSnapshot snapshot) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(snapshot, "snapshot");
    if (!snapshot.hasService(id.service())) {
      return ExpectedCount.unmanaged("no configuration found for service " + id.service());
    }
    for (DeclarationFault fault : snapshot.faults()) {
      if (fault.mayAffect(id)) {
        return ExpectedCount.unmanaged(describe(fault));
      }
    }
    long total = 0;
    for (InstanceDeclaration declaration : snapshot.declarations()) {
      if (declaration.resolvesTo(id)) {
        total += declaration.instanceCount();
      }
    }
    if (total > Integer.MAX_VALUE) {
      return ExpectedCount.unmanaged("expected instance count overflows for " + id);
    }
    return ExpectedCount.resolved((int) total);
  }

  private static String describe(DeclarationFault fault) {
    if (fault.instance() == null) {
      return "configuration of " + fault.service() + " unreadable: " + fault.reason();
    }
    return "declaration " + fault.service() + "/" + fault.instance() + " malformed: " + fault.reason();
  }
}
