package in.execguard.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.execguard.infrastructure.bridge.metrics.PrometheusResilienceMetrics;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the /metrics and /status endpoints.
 */
public class StatusServerTest {

    private static final int TEST_PORT = 19095;

    private PrometheusResilienceMetrics metrics;
    private StatusServer server;
    private HttpClient httpClient;
    private final AtomicInteger statusCalls = new AtomicInteger();

    @BeforeEach
    public void setUp() {
        metrics = new PrometheusResilienceMetrics(new CollectorRegistry());
        server = new StatusServer(metrics.getRegistry(), () -> {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("calls", statusCalls.incrementAndGet());
            status.put("failover", Map.of("currentState", "NORMAL"));
            return status;
        });
        server.start("localhost", TEST_PORT);

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        server.stop();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpoint() throws Exception {
        metrics.recordFailover("bridge-primary", "TIMEOUT");

        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("text/plain"),
            "Content-Type should be text/plain for Prometheus format");
        String body = response.body();
        assertTrue(body.contains("# TYPE execguard_failovers_total counter"), "Should declare failover counter");
        assertTrue(body.contains("cause=\"TIMEOUT\""), "Should show failover cause");
        assertTrue(body.contains("execguard_sync_duration_seconds"), "Should contain sync histogram");
    }

    @Test
    public void testStatusEndpoint() throws Exception {
        HttpResponse<String> response = get("/status");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("application/json"));
        JsonNode json = new ObjectMapper().readTree(response.body());
        assertEquals("NORMAL", json.get("failover").get("currentState").asText());

        get("/status");
        assertEquals(2, statusCalls.get(), "Snapshot is taken per request");
    }

    @Test
    public void testMetricsNameFilter() throws Exception {
        metrics.recordFailover("bridge-primary", "ERROR");

        String body = get("/metrics?name%5B%5D=execguard_failovers_total").body();

        assertTrue(body.contains("execguard_failovers_total{"), "Requested family is exported");
        assertFalse(body.contains("execguard_sync_duration_seconds"), "Other families are filtered out");
    }

    @Test
    public void testMetricsOpenMetricsFormat() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics"))
            .header("Accept", "application/openmetrics-text; version=1.0.0")
            .GET()
            .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("openmetrics"));
        assertTrue(response.body().trim().endsWith("# EOF"), "OpenMetrics output ends with # EOF");
    }

    @Test
    public void testOnlyGetIsAllowed() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/status"))
            .POST(HttpRequest.BodyPublishers.ofString("{}"))
            .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(405, response.statusCode());
        assertEquals(0, statusCalls.get(), "Snapshot is not taken for rejected requests");
    }

    @Test
    public void testUnknownPath() throws Exception {
        assertEquals(404, get("/admin").statusCode());
    }

    @Test
    public void testStartTwiceAndStop() {
        assertTrue(server.isRunning());
        server.start("localhost", TEST_PORT);
        assertTrue(server.isRunning());

        server.stop();
        assertFalse(server.isRunning());
        server.stop();
    }
}
