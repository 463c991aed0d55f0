package io.replicheck.checkservice.infra.sensu;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.replicheck.checkservice.config.ReplicationCheckProperties;
import io.replicheck.replication.model.AlertEvent;
import io.replicheck.replication.model.AlertRoute;
import io.replicheck.replication.ports.AlertDeliveryException;
import io.replicheck.replication.ports.AlertTransportPort;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Posts check results to the local Sensu client socket's HTTP endpoint.
 */
public class SensuAlertTransport implements AlertTransportPort {

    private static final Logger log = LoggerFactory.getLogger(SensuAlertTransport.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final ReplicationCheckProperties.Sensu properties;
    private final URI resultsUri;

    public SensuAlertTransport(RestTemplate restTemplate,
                               ObjectMapper mapper,
                               ReplicationCheckProperties.Sensu properties) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.resultsUri = URI.create(properties.url() + "/results");
    }

    @Override
    public void emit(AlertEvent event) {
        String json;
        try {
            json = mapper.writeValueAsString(toPayload(event));
        } catch (JsonProcessingException ex) {
            throw new AlertDeliveryException("Unable to serialize result " + event.checkId(), ex);
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<String> response =
                restTemplate.postForEntity(resultsUri, new HttpEntity<>(json, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new AlertDeliveryException("Sensu rejected " + event.checkId() + " with HTTP "
                    + response.getStatusCode().value() + ": " + Objects.toString(response.getBody(), ""));
            }
        } catch (RestClientException ex) {
            throw new AlertDeliveryException("Unable to post " + event.checkId() + " to " + resultsUri
                + ": " + ex.getMessage(), ex);
        }
        log.debug("Sent {} with status {} to Sensu", event.checkId(), event.status());
    }

    Map<String, Object> toPayload(AlertEvent event) {
        AlertRoute route = event.route();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", event.checkId());
        payload.put("status", event.status().code());
        payload.put("output", event.output());
        payload.put("runbook", route.runbook());
        payload.put("team", route.team());
        payload.put("tip", route.tip());
        payload.put("notification_email", route.notificationEmail());
        payload.put("page", route.page());
        payload.put("alert_after", properties.alertAfter());
        payload.put("check_every", properties.checkEvery());
        payload.put("realert_every", properties.realertEvery());
        if (!properties.handlers().isEmpty()) {
            payload.put("handlers", properties.handlers());
        }
        if (properties.source() != null) {
            payload.put("source", properties.source());
        }
        if (properties.ttl() != null) {
            payload.put("ttl", properties.ttl());
        }
        return payload;
    }
}
