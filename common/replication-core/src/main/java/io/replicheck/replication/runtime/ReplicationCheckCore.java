package io.replicheck.replication.runtime;

import io.replicheck.replication.model.AlertEvent;
import io.replicheck.replication.model.AlertRoute;
import io.replicheck.replication.model.AvailabilityMap;
import io.replicheck.replication.model.DeclarationSnapshot;
import io.replicheck.replication.model.Delivery;
import io.replicheck.replication.model.ExpectedCount;
import io.replicheck.replication.model.HealthStatus;
import io.replicheck.replication.model.NamespaceId;
import io.replicheck.replication.model.NamespaceOutcome;
import io.replicheck.replication.model.OutcomeState;
import io.replicheck.replication.model.ReplicationReport;
import io.replicheck.replication.model.Thresholds;
import io.replicheck.replication.model.Verdict;
import io.replicheck.replication.ports.AlertDeliveryException;
import io.replicheck.replication.ports.AlertRoutePort;
import io.replicheck.replication.ports.AlertTransportPort;
import io.replicheck.replication.ports.AvailabilityPort;
import io.replicheck.replication.ports.InstanceDeclarationPort;
import io.replicheck.replication.ports.NamespaceUniversePort;
import io.replicheck.replication.ports.RouteResolutionException;
import io.replicheck.replication.ports.SnapshotUnavailableException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives every namespace through resolve, filter, evaluate and route, producing exactly
 * one {@link NamespaceOutcome} per namespace.
 * <p>
 * The core holds no state between runs. Both input snapshots are materialised before any
 * namespace is evaluated; after that each namespace is independent and may be processed on
 * a worker thread. A failure while handling one namespace never affects another.
 */
public final class ReplicationCheckCore {

  private static final Logger log = LoggerFactory.getLogger(ReplicationCheckCore.class);

  private final NamespaceUniversePort universe;
  private final InstanceDeclarationPort declarations;
  private final AvailabilityPort availability;
  private final AlertRoutePort routes;
  private final AlertTransportPort transport;
  private final ReplicationCheckSettings settings;
  private final ExpectedInstanceAggregator aggregator = new ExpectedInstanceAggregator();
  private final ThresholdEvaluator evaluator = new ThresholdEvaluator();

  public ReplicationCheckCore(NamespaceUniversePort universe,
                              InstanceDeclarationPort declarations,
                              AvailabilityPort availability,
                              AlertRoutePort routes,
                              AlertTransportPort transport,
                              ReplicationCheckSettings settings) {
    this.universe = Objects.requireNonNull(universe, "universe");
    this.declarations = Objects.requireNonNull(declarations, "declarations");
    this.availability = Objects.requireNonNull(availability, "availability");
    this.routes = Objects.requireNonNull(routes, "routes");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Pulls the namespace universe, the declaration snapshot and the availability map, then
   * evaluates them.
   *
   * @throws SnapshotUnavailableException if any of the inputs cannot be obtained
   */
  public ReplicationReport run(Thresholds thresholds) {
    Objects.requireNonNull(thresholds, "thresholds");
    List<NamespaceId> namespaces = fetch("namespace", universe::listNamespaces);
    DeclarationSnapshot snapshot = fetch("declaration", declarations::listInstanceDeclarations);
    AvailabilityMap available = fetch("availability",
        () -> availability.getAvailableBackendCounts(namespaces));
    log.info("Checking {} namespaces ({} declarations, {} faults, {} availability entries)",
        namespaces.size(), snapshot.declarations().size(), snapshot.faults().size(), available.size());
    return runCheck(namespaces, snapshot, available, thresholds);
  }

  /**
   * Evaluates already materialised snapshots. Duplicate namespaces in the universe are
   * evaluated once.
   */
  public ReplicationReport runCheck(List<NamespaceId> namespaces,
                                    DeclarationSnapshot snapshot,
                                    AvailabilityMap available,
                                    Thresholds thresholds) {
    Objects.requireNonNull(namespaces, "namespaces");
    Objects.requireNonNull(snapshot, "snapshot");
    Objects.requireNonNull(available, "available");
    Objects.requireNonNull(thresholds, "thresholds");
    List<NamespaceId> unique = List.copyOf(new LinkedHashSet<>(namespaces));
    int workers = Math.min(settings.parallelism(), unique.size());
    if (workers <= 1) {
      List<NamespaceOutcome> outcomes = new ArrayList<>(unique.size());
      for (NamespaceId id : unique) {
        outcomes.add(check(id, snapshot, available, thresholds));
      }
      return new ReplicationReport(outcomes);
    }
    return runParallel(unique, workers, snapshot, available, thresholds);
  }

  private ReplicationReport runParallel(List<NamespaceId> namespaces,
                                        int workers,
                                        DeclarationSnapshot snapshot,
                                        AvailabilityMap available,
                                        Thresholds thresholds) {
    ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
    try {
      List<Future<NamespaceOutcome>> futures = new ArrayList<>(namespaces.size());
      for (NamespaceId id : namespaces) {
        futures.add(executor.submit(() -> check(id, snapshot, available, thresholds)));
      }
      List<NamespaceOutcome> outcomes = new ArrayList<>(namespaces.size());
      for (int i = 0; i < futures.size(); i++) {
        outcomes.add(await(namespaces.get(i), futures.get(i)));
      }
      return new ReplicationReport(outcomes);
    } finally {
      executor.shutdownNow();
    }
  }

  private NamespaceOutcome await(NamespaceId id, Future<NamespaceOutcome> future) {
    try {
      return future.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while checking namespace " + id, ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
      log.warn("Namespace {} failed unexpectedly; treating it as not managed", id, cause);
      return NamespaceOutcome.skipped(id, OutcomeState.SKIPPED_NOT_MANAGED, describe(cause));
    }
  }

  NamespaceOutcome check(NamespaceId id,
                         DeclarationSnapshot snapshot,
                         AvailabilityMap available,
                         Thresholds thresholds) {
    try {
      return evaluate(id, snapshot, available, thresholds);
    } catch (RuntimeException ex) {
      log.warn("Namespace {} failed unexpectedly; treating it as not managed", id, ex);
      return NamespaceOutcome.skipped(id, OutcomeState.SKIPPED_NOT_MANAGED, describe(ex));
    }
  }

  private NamespaceOutcome evaluate(NamespaceId id,
                                    DeclarationSnapshot snapshot,
                                    AvailabilityMap available,
                                    Thresholds thresholds) {
    trace("Checking namespace {}", id);
    ExpectedCount expected = aggregator.expectedCount(id, snapshot);
    if (!expected.managed()) {
      trace("Namespace {} isn't managed by the orchestrator: {}", id, expected.reason());
      return NamespaceOutcome.skipped(id, OutcomeState.SKIPPED_NOT_MANAGED, expected.reason());
    }
    if (expected.count() == 0) {
      trace("Namespace {} doesn't have any expected instances", id);
      return NamespaceOutcome.skipped(id, OutcomeState.SKIPPED_NOT_IN_SCOPE, "no expected instances");
    }

    OptionalInt count = available.availableFor(id);
    OutcomeState state;
    Verdict verdict;
    if (count.isEmpty()) {
      state = OutcomeState.NO_DATA;
      verdict = evaluator.noData(id);
    } else {
      state = OutcomeState.EVALUATED;
      verdict = evaluator.evaluate(id, expected.count(), count.getAsInt(), thresholds);
    }
    logVerdict(verdict);
    return route(id, state, verdict);
  }

  private NamespaceOutcome route(NamespaceId id, OutcomeState state, Verdict verdict) {
    Optional<AlertRoute> route;
    try {
      route = routes.resolveRoute(id.service());
    } catch (RouteResolutionException ex) {
      log.warn("Unable to resolve alert route for {}: {}", id, ex.getMessage());
      return new NamespaceOutcome(id, state, verdict, Delivery.FAILED, ex.getMessage());
    } catch (RuntimeException ex) {
      log.warn("Alert route lookup for {} failed unexpectedly", id, ex);
      return new NamespaceOutcome(id, state, verdict, Delivery.FAILED, describe(ex));
    }
    if (route.isEmpty()) {
      trace("No team configured for service {}; suppressing alert for {}", id.service(), id);
      return new NamespaceOutcome(id, state, verdict, Delivery.SUPPRESSED, "no team configured");
    }
    AlertEvent event = new AlertEvent(settings.checkId(id), verdict.status(), verdict.message(), route.get());
    try {
      transport.emit(event);
    } catch (AlertDeliveryException ex) {
      log.warn("Failed to deliver {} for {}: {}", event.checkId(), id, ex.getMessage());
      return new NamespaceOutcome(id, state, verdict, Delivery.FAILED, ex.getMessage());
    } catch (RuntimeException ex) {
      log.warn("Transport failed unexpectedly delivering {} for {}", event.checkId(), id, ex);
      return new NamespaceOutcome(id, state, verdict, Delivery.FAILED, describe(ex));
    }
    return new NamespaceOutcome(id, state, verdict, Delivery.EMITTED, null);
  }

  private void logVerdict(Verdict verdict) {
    if (verdict.status() == HealthStatus.CRITICAL) {
      log.error(verdict.message());
    } else if (verdict.status() == HealthStatus.WARNING) {
      log.warn(verdict.message());
    } else {
      trace(verdict.message());
    }
  }

  private void trace(String format, Object... args) {
    if (settings.verbose()) {
      log.info(format, args);
    } else {
      log.debug(format, args);
    }
  }

  private static <T> T fetch(String name, Supplier<T> supplier) {
    T value;
    try {
      value = supplier.get();
    } catch (SnapshotUnavailableException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new SnapshotUnavailableException(name, ex);
    }
    if (value == null) {
      throw new SnapshotUnavailableException(name, new IllegalStateException(name + " source returned null"));
    }
    return value;
  }

  private static String describe(Throwable ex) {
    return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
  }

  private static final class WorkerThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread thread = new Thread(r, "replication-check-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
