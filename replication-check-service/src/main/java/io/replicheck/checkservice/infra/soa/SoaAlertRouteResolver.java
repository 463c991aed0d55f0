package io.replicheck.checkservice.infra.soa;

import io.replicheck.replication.model.AlertRoute;
import io.replicheck.replication.ports.AlertRoutePort;
import io.replicheck.replication.ports.RouteResolutionException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves alert routing from {@code service.yaml}, overridden key by key by
 * {@code monitoring.yaml}. A service without a {@code team} is unmanaged.
 */
public class SoaAlertRouteResolver implements AlertRoutePort {

    static final String SERVICE_FILE = "service.yaml";
    static final String MONITORING_FILE = "monitoring.yaml";

    static final String DEFAULT_RUNBOOK =
        "Please set a `runbook` field in your monitoring.yaml pointing at the service runbook";
    static final String DEFAULT_TIP =
        "Please set a `tip` field in your monitoring.yaml with a hint for the on-call engineer";

    private final SoaConfigurationReader reader;

    public SoaAlertRouteResolver(SoaConfigurationReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    @Override
    public Optional<AlertRoute> resolveRoute(String service) {
        Map<String, Object> merged = new HashMap<>();
        try {
            reader.readMapping(service, SERVICE_FILE).ifPresent(merged::putAll);
            reader.readMapping(service, MONITORING_FILE).ifPresent(merged::putAll);
        } catch (SoaConfigurationException ex) {
            throw new RouteResolutionException("Monitoring configuration of " + service + " is unreadable", ex);
        }
        String team = text(merged.get("team"));
        if (team == null) {
            return Optional.empty();
        }
        return Optional.of(new AlertRoute(
            team,
            Objects.requireNonNullElse(text(merged.get("runbook")), DEFAULT_RUNBOOK),
            Objects.requireNonNullElse(text(merged.get("tip")), DEFAULT_TIP),
            text(merged.get("notification_email")),
            flag(merged.get("page"))));
    }

    private static String text(Object value) {
        if (value == null || value instanceof Boolean) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static boolean flag(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString().trim());
    }
}
