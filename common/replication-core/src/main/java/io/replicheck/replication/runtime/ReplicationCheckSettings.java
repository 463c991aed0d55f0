package io.replicheck.replication.runtime;

import io.replicheck.replication.model.NamespaceId;

/**
 * Static knobs of the check core.
 *
 * @param checkNamePrefix prefix of generated check ids
 * @param parallelism     worker threads used to evaluate namespaces; 1 evaluates on the caller
 * @param verbose         log per-namespace progress at INFO instead of DEBUG
 */
public record ReplicationCheckSettings(String checkNamePrefix, int parallelism, boolean verbose) {

  public static final String DEFAULT_CHECK_NAME_PREFIX = "check_marathon_services_replication";
  public static final int DEFAULT_PARALLELISM = 4;

  public ReplicationCheckSettings {
    if (checkNamePrefix == null || checkNamePrefix.isBlank()) {
      checkNamePrefix = DEFAULT_CHECK_NAME_PREFIX;
    }
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
    }
  }

  public String checkId(NamespaceId id) {
    return checkNamePrefix + "." + id.service() + "." + id.namespace();
  }
}
