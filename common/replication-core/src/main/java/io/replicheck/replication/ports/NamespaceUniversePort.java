package io.replicheck.replication.ports;

import io.replicheck.replication.model.NamespaceId;
import java.util.List;

/**
 * Source of every namespace the check should look at.
 */
public interface NamespaceUniversePort {

  /**
   * @return all known namespaces, never null
   * @throws RuntimeException if the namespace registry cannot be read at all
   */
  List<NamespaceId> listNamespaces();
}
