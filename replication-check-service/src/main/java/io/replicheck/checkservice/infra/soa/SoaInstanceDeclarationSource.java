package io.replicheck.checkservice.infra.soa;

import io.replicheck.replication.model.DeclarationFault;
import io.replicheck.replication.model.DeclarationSnapshot;
import io.replicheck.replication.model.InstanceDeclaration;
import io.replicheck.replication.ports.InstanceDeclarationPort;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads Marathon instance declarations from {@code <service>/marathon-<cluster>.yaml}.
 * <p>
 * Each top-level key is an instance name mapping to its settings. {@code instances}
 * defaults to 1 and {@code nerve_ns} overrides the namespace the instance registers under.
 * Entries that do not have that shape are reported as faults instead of failing the snapshot.
 */
public class SoaInstanceDeclarationSource implements InstanceDeclarationPort {

    static final String INSTANCES_KEY = "instances";
    static final String NAMESPACE_KEY = "nerve_ns";
    static final int DEFAULT_INSTANCES = 1;

    private static final Logger log = LoggerFactory.getLogger(SoaInstanceDeclarationSource.class);

    private final SoaConfigurationReader reader;
    private final String cluster;

    public SoaInstanceDeclarationSource(SoaConfigurationReader reader, String cluster) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.cluster = Objects.requireNonNull(cluster, "cluster");
    }

    private String clusterFile() {
        return "marathon-" + cluster + ".yaml";
    }

    @Override
    public DeclarationSnapshot listInstanceDeclarations() {
        List<InstanceDeclaration> declarations = new ArrayList<>();
        List<DeclarationFault> faults = new ArrayList<>();
        Set<String> services = new LinkedHashSet<>();
        for (String service : reader.listServices()) {
            services.add(service);
            Optional<Map<String, Object>> instances;
            try {
                instances = reader.readMapping(service, clusterFile());
            } catch (SoaConfigurationException ex) {
                log.warn("Configuration of {} for cluster {} is unreadable: {}", service, cluster, ex.getMessage());
                faults.add(DeclarationFault.serviceWide(service, ex.getMessage()));
                continue;
            }
            instances.ifPresent(entries -> entries.forEach(
                (instance, config) -> readInstance(service, instance, config, declarations, faults)));
        }
        log.debug("Read {} declarations and {} faults from {} services in {}",
            declarations.size(), faults.size(), services.size(), reader.soaDir());
        return new DeclarationSnapshot(declarations, faults, services);
    }

    private void readInstance(String service,
                              String instance,
                              Object config,
                              List<InstanceDeclaration> declarations,
                              List<DeclarationFault> faults) {
        if (config != null && !(config instanceof Map)) {
            faults.add(new DeclarationFault(service, instance, instance,
                "instance definition is not a mapping"));
            return;
        }
        Map<?, ?> settings = config == null ? Map.of() : (Map<?, ?>) config;

        Object rawNamespace = settings.get(NAMESPACE_KEY);
        if (rawNamespace != null && !(rawNamespace instanceof String)) {
            faults.add(new DeclarationFault(service, instance, null,
                NAMESPACE_KEY + " must be a string but was " + rawNamespace));
            return;
        }
        String namespace = (String) rawNamespace;
        String effective = namespace != null ? namespace : instance;

        Object rawCount = settings.get(INSTANCES_KEY);
        int count;
        if (rawCount == null) {
            count = DEFAULT_INSTANCES;
        } else if (rawCount instanceof Integer value) {
            count = value;
        } else {
            faults.add(new DeclarationFault(service, instance, effective,
                INSTANCES_KEY + " must be an integer but was " + rawCount));
            return;
        }
        if (count < 0) {
            faults.add(new DeclarationFault(service, instance, effective,
                INSTANCES_KEY + " must not be negative but was " + count));
            return;
        }
        declarations.add(new InstanceDeclaration(service, instance, namespace, count));
    }
}
