package io.replicheck.checkservice.infra.sensu;

import io.replicheck.replication.model.AlertEvent;
import io.replicheck.replication.ports.AlertTransportPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when Sensu delivery is switched off; results only reach the log.
 */
public class LoggingAlertTransport implements AlertTransportPort {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertTransport.class);

    @Override
    public void emit(AlertEvent event) {
        log.info("result {} status={} team={} output={}",
            event.checkId(), event.status(), event.route().team(), event.output());
    }
}
