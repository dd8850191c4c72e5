package tech.regionguard.failover.probe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.regionguard.failover.model.HealthSample;
import tech.regionguard.failover.model.RegionId;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Probes a region's /health endpoint.
 *
 * A sample succeeds when the endpoint answers 200, the JSON body (if any) reports
 * {@code "status": "healthy"} (or MicroProfile Health {@code "UP"}), and the round trip stays
 * within the latency threshold.
 */
public class HttpHealthEndpointProbe implements RegionProbe {

    private static final Logger LOG = Logger.getLogger(HttpHealthEndpointProbe.class);
    private static final String HEALTHY = "healthy";
    private static final String UP = "UP";

    private final String id;
    private final Map<RegionId, URI> endpoints;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final long latencyThresholdMillis;
    private final Clock clock;

    public HttpHealthEndpointProbe(String id, Map<RegionId, URI> endpoints, HttpClient httpClient,
                                   ObjectMapper objectMapper, Duration timeout, long latencyThresholdMillis,
                                   Clock clock) {
        this.id = id;
        this.endpoints = Map.copyOf(endpoints);
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        this.latencyThresholdMillis = latencyThresholdMillis;
        this.clock = clock;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Set<RegionId> regions() {
        return endpoints.keySet();
    }

    @Override
    public HealthSample sample(RegionId regionId) throws Exception {
        URI endpoint = endpoints.get(regionId);
        if (endpoint == null) {
            throw new IllegalArgumentException("Probe " + id + " has no endpoint for region " + regionId);
        }

        HttpRequest request = HttpRequest.newBuilder(endpoint)
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        long startMillis = clock.millis();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        long endMillis = clock.millis();
        long latency = endMillis - startMillis;

        if (response.statusCode() != 200) {
            LOG.debugf("Probe %s: %s returned HTTP %d", id, endpoint, response.statusCode());
            return HealthSample.failure(regionId, id, endMillis, latency);
        }
        if (!reportsHealthy(response.body())) {
            LOG.debugf("Probe %s: %s did not report healthy", id, endpoint);
            return HealthSample.failure(regionId, id, endMillis, latency);
        }
        if (latency > latencyThresholdMillis) {
            LOG.debugf("Probe %s: %s answered in %dms (threshold %dms)", id, endpoint, latency, latencyThresholdMillis);
            return HealthSample.failure(regionId, id, endMillis, latency);
        }
        return HealthSample.success(regionId, id, endMillis, latency);
    }

    private boolean reportsHealthy(String body) {
        if (body == null || body.isBlank()) {
            return true;
        }
        try {
            JsonNode status = objectMapper.readTree(body).get("status");
            return status == null || HEALTHY.equalsIgnoreCase(status.asText()) || UP.equalsIgnoreCase(status.asText());
        } catch (Exception e) {
            LOG.debugf("Unparseable health body: %s", e.getMessage());
            return false;
        }
    }
}
