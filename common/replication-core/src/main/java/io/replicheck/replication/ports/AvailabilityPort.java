package io.replicheck.replication.ports;

import io.replicheck.replication.model.AvailabilityMap;
import io.replicheck.replication.model.NamespaceId;
import java.util.Collection;

/**
 * Queries the discovery layer for healthy backend counts.
 */
public interface AvailabilityPort {

  /**
   * Return one snapshot of available backends for the given namespaces. Namespaces the
   * discovery layer does not know about are left out of the map.
   */
  AvailabilityMap getAvailableBackendCounts(Collection<NamespaceId> namespaces);
}
