package io.replicheck.checkservice.infra.synapse;

import io.replicheck.checkservice.config.ReplicationCheckProperties;
import io.replicheck.replication.model.AvailabilityMap;
import io.replicheck.replication.model.NamespaceId;
import io.replicheck.replication.ports.AvailabilityPort;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads backend availability from the local Synapse HAProxy stats page.
 */
public class SynapseAvailabilityClient implements AvailabilityPort {

    private static final Logger log = LoggerFactory.getLogger(SynapseAvailabilityClient.class);
    private static final String STATS_PATH = "/;csv;norefresh";

    private final HttpClient http;
    private final URI statsUri;
    private final Duration requestTimeout;

    public SynapseAvailabilityClient(ReplicationCheckProperties.Synapse properties) {
        this(HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build(), properties);
    }

    SynapseAvailabilityClient(HttpClient http, ReplicationCheckProperties.Synapse properties) {
        Objects.requireNonNull(properties, "properties");
        this.http = Objects.requireNonNull(http, "http");
        this.statsUri = URI.create("http://" + properties.hostPort() + STATS_PATH);
        this.requestTimeout = properties.readTimeout();
    }

    @Override
    public AvailabilityMap getAvailableBackendCounts(Collection<NamespaceId> namespaces) {
        List<String> backends = List.copyOf(namespaces.stream()
            .map(NamespaceId::encode)
            .collect(Collectors.toCollection(LinkedHashSet::new)));
        if (backends.isEmpty()) {
            return AvailabilityMap.empty();
        }
        String body = fetchStats();
        Map<String, Integer> counts = HaproxyStatsParser.countAvailable(body, backends);
        log.debug("Synapse reported {} of {} requested backends", counts.size(), backends.size());
        return AvailabilityMap.fromEncoded(counts);
    }

    private String fetchStats() {
        log.debug("fetching HAProxy stats from {}", statsUri);
        HttpRequest req = HttpRequest.newBuilder()
            .uri(statsUri)
            .timeout(requestTimeout)
            .GET()
            .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to reach Synapse at " + statsUri + ": " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while fetching Synapse stats from " + statsUri, ex);
        }
        if (resp.statusCode() != 200) {
            throw new IllegalStateException("Synapse stats fetch status " + resp.statusCode() + " from " + statsUri);
        }
        return resp.body() != null ? resp.body() : "";
    }
}
