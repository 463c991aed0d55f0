package io.replicheck.replication.ports;

import io.replicheck.replication.model.DeclarationSnapshot;

/**
 * Reads orchestrator instance declarations.
 * <p>
 * Implementations report per-entry structural problems as
 * {@link io.replicheck.replication.model.DeclarationFault}s inside the snapshot and only
 * throw when nothing can be read.
 */
public interface InstanceDeclarationPort {

  DeclarationSnapshot listInstanceDeclarations();
}
