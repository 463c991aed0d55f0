package io.replicheck.checkservice.app;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.replicheck.replication.model.NamespaceOutcome;
import io.replicheck.replication.model.ReplicationReport;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records per-run and per-namespace counters for the replication check.
 */
public final class ReplicationCheckMetrics {

    static final String OUTCOMES = "replicheck_namespace_outcomes_total";
    static final String RUNS = "replicheck_runs_total";
    static final String LAST_RUN_NAMESPACES = "replicheck_last_run_namespaces";

    private static final String NO_STATUS = "none";

    private final MeterRegistry meterRegistry;
    private final AtomicInteger lastRunNamespaces = new AtomicInteger();

    public ReplicationCheckMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        Gauge.builder(LAST_RUN_NAMESPACES, lastRunNamespaces, AtomicInteger::get)
            .description("Namespaces processed by the most recent successful run")
            .register(meterRegistry);
    }

    public void recordSuccess(ReplicationReport report) {
        for (NamespaceOutcome outcome : report.outcomes()) {
            Counter.builder(OUTCOMES)
                .description("Namespace outcomes by state, status and delivery")
                .tag("state", outcome.state().name())
                .tag("status", outcome.status().map(Enum::name).orElse(NO_STATUS))
                .tag("delivery", outcome.delivery().name())
                .register(meterRegistry)
                .increment();
        }
        lastRunNamespaces.set(report.size());
        run("success");
    }

    public void recordFailure() {
        run("failure");
    }

    public void recordSkipped() {
        run("skipped");
    }

    private void run(String result) {
        Counter.builder(RUNS)
            .description("Replication check runs by result")
            .tag("result", result)
            .register(meterRegistry)
            .increment();
    }
}
