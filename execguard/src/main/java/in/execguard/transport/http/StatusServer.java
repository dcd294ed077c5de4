package in.execguard.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Undertow server exposing the resilience subsystem for operators.
 *
 * - GET /metrics - Prometheus exposition; honours the Accept header
 *   (text 0.0.4 or OpenMetrics) and {@code name[]} filters
 * - GET /status  - JSON snapshot of component metrics
 *
 * Other methods get 405, other paths 404.
 */
public final class StatusServer {
    private static final Logger log = LoggerFactory.getLogger(StatusServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final CollectorRegistry registry;
    private final Supplier<Map<String, Object>> snapshot;
    private Undertow server;

    public StatusServer(CollectorRegistry registry, Supplier<Map<String, Object>> snapshot) {
        this.registry = registry;
        this.snapshot = snapshot;
    }

    public synchronized void start(String host, int port) {
        if (server != null) {
            log.warn("[StatusServer] Already running");
            return;
        }
        PathHandler paths = Handlers.path()
            .addExactPath("/metrics", getOnly(this::serveMetrics))
            .addExactPath("/status", getOnly(this::serveStatus));

        server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(paths)
            .build();
        server.start();
        log.info("[StatusServer] Listening on {}:{} (/metrics, /status)", host, port);
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop();
            server = null;
            log.info("[StatusServer] Stopped");
        }
    }

    public synchronized boolean isRunning() {
        return server != null;
    }

    private void serveMetrics(HttpServerExchange exchange) {
        Set<String> names = new LinkedHashSet<>();
        Deque<String> requested = exchange.getQueryParameters().get("name[]");
        if (requested != null) {
            names.addAll(requested);
        }
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));

        try {
            StringWriter writer = new StringWriter();
            TextFormat.writeFormat(contentType, writer,
                names.isEmpty() ? registry.metricFamilySamples() : registry.filteredMetricFamilySamples(names));
            String body = writer.toString();

            exchange.setStatusCode(StatusCodes.OK);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
            exchange.getResponseSender().send(body, StandardCharsets.UTF_8);
            log.debug("[StatusServer] Served metrics ({} bytes, filter: {})", body.length(), names);
        } catch (Exception e) {
            log.error("[StatusServer] Failed to export metrics: {}", e.getMessage(), e);
            sendError(exchange, "Failed to export metrics: " + e.getMessage());
        }
    }

    private void serveStatus(HttpServerExchange exchange) {
        try {
            String json = MAPPER.writeValueAsString(snapshot.get());
            exchange.setStatusCode(StatusCodes.OK);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.error("[StatusServer] Failed to build status: {}", e.getMessage(), e);
            sendError(exchange, "Failed to build status: " + e.getMessage());
        }
    }

    private static HttpHandler getOnly(HttpHandler handler) {
        return exchange -> {
            if (!Methods.GET.equals(exchange.getRequestMethod())) {
                exchange.setStatusCode(StatusCodes.METHOD_NOT_ALLOWED);
                exchange.getResponseHeaders().put(Headers.ALLOW, Methods.GET_STRING);
                exchange.endExchange();
                return;
            }
            handler.handleRequest(exchange);
        };
    }

    private static void sendError(HttpServerExchange exchange, String message) {
        exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
