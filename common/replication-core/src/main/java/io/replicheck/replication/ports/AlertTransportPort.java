package io.replicheck.replication.ports;

import io.replicheck.replication.model.AlertEvent;

/**
 * Delivers alert events. Implementations must accept concurrent calls; the core emits
 * independent events from several worker threads and never retries.
 */
public interface AlertTransportPort {

  /**
   * @throws AlertDeliveryException when the event could not be handed over
   */
  void emit(AlertEvent event);
}
