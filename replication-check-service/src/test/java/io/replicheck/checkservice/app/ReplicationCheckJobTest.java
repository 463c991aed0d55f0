package io.replicheck.checkservice.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.replicheck.replication.model.AlertEvent;
import io.replicheck.replication.model.AlertRoute;
import io.replicheck.replication.model.AvailabilityMap;
import io.replicheck.replication.model.DeclarationSnapshot;
import io.replicheck.replication.model.InstanceDeclaration;
import io.replicheck.replication.model.NamespaceId;
import io.replicheck.replication.model.ReplicationReport;
import io.replicheck.replication.model.Thresholds;
import io.replicheck.replication.ports.AvailabilityPort;
import io.replicheck.replication.runtime.ReplicationCheckCore;
import io.replicheck.replication.runtime.ReplicationCheckSettings;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReplicationCheckJobTest {

    private static final NamespaceId WEB_MAIN = NamespaceId.of("web", "main");
    private static final NamespaceId WEB_CANARY = NamespaceId.of("web", "canary");

    private final List<AlertEvent> emitted = new CopyOnWriteArrayList<>();
    private SimpleMeterRegistry registry;
    private ReplicationCheckMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ReplicationCheckMetrics(registry);
    }

    @Test
    void recordsOutcomesOfSuccessfulRun() {
        ReplicationCheckJob job = job(namespaces -> AvailabilityMap.of(Map.of(WEB_MAIN, 1)));

        Optional<ReplicationReport> report = job.runOnce();

        assertThat(report).isPresent();
        assertThat(report.get().size()).isEqualTo(2);
        assertThat(emitted).extracting(AlertEvent::checkId)
            .containsExactlyInAnyOrder("check_marathon_services_replication.web.main", "check_marathon_services_replication.web.canary");
        assertThat(registry.get(ReplicationCheckMetrics.RUNS).tag("result", "success").counter().count())
            .isEqualTo(1.0);
        assertThat(registry.get(ReplicationCheckMetrics.OUTCOMES)
            .tag("state", "EVALUATED").tag("status", "CRITICAL").tag("delivery", "EMITTED")
            .counter().count()).isEqualTo(1.0);
        assertThat(registry.get(ReplicationCheckMetrics.OUTCOMES)
            .tag("state", "NO_DATA").tag("status", "CRITICAL").tag("delivery", "EMITTED")
            .counter().count()).isEqualTo(1.0);
        assertThat(registry.get(ReplicationCheckMetrics.LAST_RUN_NAMESPACES).gauge().value()).isEqualTo(2.0);
    }

    @Test
    void countsFailedRunWhenAvailabilityIsUnreachable() {
        ReplicationCheckJob job = job(namespaces -> {
            throw new IllegalStateException("Synapse stats fetch status 503");
        });

        Optional<ReplicationReport> report = job.runOnce();

        assertThat(report).isEmpty();
        assertThat(emitted).isEmpty();
        assertThat(registry.get(ReplicationCheckMetrics.RUNS).tag("result", "failure").counter().count())
            .isEqualTo(1.0);
        assertThat(registry.get(ReplicationCheckMetrics.LAST_RUN_NAMESPACES).gauge().value()).isZero();
    }

    private ReplicationCheckJob job(AvailabilityPort availability) {
        DeclarationSnapshot snapshot = new DeclarationSnapshot(
            List.of(
                new InstanceDeclaration("web", "main", null, 10),
                new InstanceDeclaration("web", "canary", null, 1)),
            List.of(),
            Set.of("web"));
        ReplicationCheckCore core = new ReplicationCheckCore(
            () -> List.of(WEB_MAIN, WEB_CANARY),
            () -> snapshot,
            availability,
            service -> Optional.of(new AlertRoute("web-oncall", "y/runbook", "tip", null, false)),
            emitted::add,
            new ReplicationCheckSettings(null, 1, false));
        return new ReplicationCheckJob(core, Thresholds.defaults(), metrics);
    }
}
