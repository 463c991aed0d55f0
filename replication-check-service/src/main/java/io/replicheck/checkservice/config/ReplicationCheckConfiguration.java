package io.replicheck.checkservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.replicheck.checkservice.app.ReplicationCheckJob;
import io.replicheck.checkservice.app.ReplicationCheckMetrics;
import io.replicheck.checkservice.infra.sensu.LoggingAlertTransport;
import io.replicheck.checkservice.infra.sensu.SensuAlertTransport;
import io.replicheck.checkservice.infra.soa.SoaAlertRouteResolver;
import io.replicheck.checkservice.infra.soa.SoaConfigurationReader;
import io.replicheck.checkservice.infra.soa.SoaInstanceDeclarationSource;
import io.replicheck.checkservice.infra.soa.SoaNamespaceRegistry;
import io.replicheck.checkservice.infra.synapse.SynapseAvailabilityClient;
import io.replicheck.replication.ports.AlertRoutePort;
import io.replicheck.replication.ports.AlertTransportPort;
import io.replicheck.replication.ports.AvailabilityPort;
import io.replicheck.replication.ports.InstanceDeclarationPort;
import io.replicheck.replication.ports.NamespaceUniversePort;
import io.replicheck.replication.runtime.ReplicationCheckCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReplicationCheckConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ReplicationCheckConfiguration.class);

    @Bean
    SoaConfigurationReader soaConfigurationReader(ReplicationCheckProperties properties) {
        return new SoaConfigurationReader(properties.getSoaDir());
    }

    @Bean
    NamespaceUniversePort namespaceUniverse(SoaConfigurationReader reader) {
        return new SoaNamespaceRegistry(reader);
    }

    @Bean
    InstanceDeclarationPort instanceDeclarations(SoaConfigurationReader reader, ReplicationCheckProperties properties) {
        return new SoaInstanceDeclarationSource(reader, properties.getCluster());
    }

    @Bean
    AlertRoutePort alertRoutes(SoaConfigurationReader reader) {
        return new SoaAlertRouteResolver(reader);
    }

    @Bean
    AvailabilityPort availability(ReplicationCheckProperties properties) {
        return new SynapseAvailabilityClient(properties.getSynapse());
    }

    @Bean
    AlertTransportPort alertTransport(ReplicationCheckProperties properties,
                                      RestTemplateBuilder restTemplateBuilder,
                                      ObjectMapper objectMapper) {
        ReplicationCheckProperties.Sensu sensu = properties.getSensu();
        if (!sensu.enabled()) {
            log.info("Sensu delivery disabled; check results will only be logged");
            return new LoggingAlertTransport();
        }
        return new SensuAlertTransport(
            restTemplateBuilder
                .setConnectTimeout(sensu.connectTimeout())
                .setReadTimeout(sensu.readTimeout())
                .build(),
            objectMapper,
            sensu);
    }

    @Bean
    ReplicationCheckCore replicationCheckCore(NamespaceUniversePort universe,
                                              InstanceDeclarationPort declarations,
                                              AvailabilityPort availability,
                                              AlertRoutePort routes,
                                              AlertTransportPort transport,
                                              ReplicationCheckProperties properties) {
        return new ReplicationCheckCore(universe, declarations, availability, routes, transport,
            properties.toSettings());
    }

    @Bean
    ReplicationCheckProperties.Schedule replicationCheckSchedule(ReplicationCheckProperties properties) {
        return properties.getSchedule();
    }

    @Bean
    ReplicationCheckMetrics replicationCheckMetrics(MeterRegistry meterRegistry) {
        return new ReplicationCheckMetrics(meterRegistry);
    }

    @Bean
    ReplicationCheckJob replicationCheckJob(ReplicationCheckCore core,
                                            ReplicationCheckProperties properties,
                                            ReplicationCheckMetrics metrics) {
        return new ReplicationCheckJob(core, properties.getThresholds().toThresholds(), metrics);
    }
}
