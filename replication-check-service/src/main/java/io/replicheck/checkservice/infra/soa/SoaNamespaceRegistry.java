package io.replicheck.checkservice.infra.soa;

import io.replicheck.replication.model.NamespaceId;
import io.replicheck.replication.ports.NamespaceUniversePort;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists every {@code service.namespace} advertised in the services' {@code smartstack.yaml}.
 */
public class SoaNamespaceRegistry implements NamespaceUniversePort {

    static final String SMARTSTACK_FILE = "smartstack.yaml";

    private static final Logger log = LoggerFactory.getLogger(SoaNamespaceRegistry.class);

    private final SoaConfigurationReader reader;

    public SoaNamespaceRegistry(SoaConfigurationReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    @Override
    public List<NamespaceId> listNamespaces() {
        List<NamespaceId> namespaces = new ArrayList<>();
        for (String service : reader.listServices()) {
            Map<String, Object> smartstack;
            try {
                smartstack = reader.readMapping(service, SMARTSTACK_FILE).orElse(Map.of());
            } catch (SoaConfigurationException ex) {
                log.warn("Ignoring namespaces of {}: {}", service, ex.getMessage());
                continue;
            }
            for (String namespace : smartstack.keySet()) {
                try {
                    namespaces.add(NamespaceId.of(service, namespace));
                } catch (IllegalArgumentException ex) {
                    log.warn("Ignoring namespace '{}' of {}: {}", namespace, service, ex.getMessage());
                }
            }
        }
        Collections.sort(namespaces);
        return List.copyOf(namespaces);
    }
}
