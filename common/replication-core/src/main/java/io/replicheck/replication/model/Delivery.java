package io.replicheck.replication.model;

public enum Delivery {
  NOT_ATTEMPTED,
  EMITTED,
  SUPPRESSED,
  FAILED
}
