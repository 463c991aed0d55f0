package io.replicheck.checkservice.app;

import io.replicheck.replication.model.Delivery;
import io.replicheck.replication.model.HealthStatus;
import io.replicheck.replication.model.OutcomeState;
import io.replicheck.replication.model.ReplicationReport;
import io.replicheck.replication.model.Thresholds;
import io.replicheck.replication.ports.SnapshotUnavailableException;
import io.replicheck.replication.runtime.ReplicationCheckCore;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one replication check and reports what happened. Overlapping invocations are skipped
 * rather than queued.
 */
public class ReplicationCheckJob {

    private static final Logger log = LoggerFactory.getLogger(ReplicationCheckJob.class);

    private final ReplicationCheckCore core;
    private final Thresholds thresholds;
    private final ReplicationCheckMetrics metrics;
    private final ReentrantLock running = new ReentrantLock();

    public ReplicationCheckJob(ReplicationCheckCore core, Thresholds thresholds, ReplicationCheckMetrics metrics) {
        this.core = Objects.requireNonNull(core, "core");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * @return the report, or empty when the inputs could not be read or a run was already in progress
     */
    public Optional<ReplicationReport> runOnce() {
        if (!running.tryLock()) {
            log.warn("Replication check already in progress; skipping this trigger");
            metrics.recordSkipped();
            return Optional.empty();
        }
        try {
            long started = System.nanoTime();
            ReplicationReport report = core.run(thresholds);
            metrics.recordSuccess(report);
            logSummary(report, (System.nanoTime() - started) / 1_000_000);
            return Optional.of(report);
        } catch (SnapshotUnavailableException ex) {
            log.error("Replication check aborted, {} snapshot unavailable: {}", ex.snapshot(), ex.getMessage(), ex);
            metrics.recordFailure();
            return Optional.empty();
        } finally {
            running.unlock();
        }
    }

    private static void logSummary(ReplicationReport report, long elapsedMs) {
        log.info("Replication check finished in {} ms: {} namespaces, {} evaluated, {} no data, "
                + "{} not managed, {} not in scope; {} ok, {} warning, {} critical; "
                + "{} emitted, {} suppressed, {} failed",
            elapsedMs,
            report.size(),
            report.count(OutcomeState.EVALUATED),
            report.count(OutcomeState.NO_DATA),
            report.count(OutcomeState.SKIPPED_NOT_MANAGED),
            report.count(OutcomeState.SKIPPED_NOT_IN_SCOPE),
            report.count(HealthStatus.OK),
            report.count(HealthStatus.WARNING),
            report.count(HealthStatus.CRITICAL),
            report.count(Delivery.EMITTED),
            report.count(Delivery.SUPPRESSED),
            report.count(Delivery.FAILED));
    }
}
