package in.execguard.infrastructure.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.execguard.application.port.output.AuditSink;
import in.execguard.domain.event.ResilienceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Audit sink writing one JSON line per resilience event through SLF4J.
 *
 * Lines go to the {@code execguard.audit} logger so they can be routed to a
 * separate appender. String payload values are sanitized: bearer tokens,
 * api keys, tokens and passwords in error messages are masked.
 *
 * Example line:
 * <pre>
 * [AUDIT] {"event":"failover","subject":"bridge-primary","timestamp":"2024-01-15T10:30:00Z",
 *          "payload":{"cause":"Bridge execution timed out","signalId":"sig-1","failoverCount":1}}
 * </pre>
 */
public class Slf4jAuditSink implements AuditSink {
    private static final Logger audit = LoggerFactory.getLogger("execguard.audit");
    private static final Logger log = LoggerFactory.getLogger(Slf4jAuditSink.class);

    private static final Pattern BEARER_TOKEN_PATTERN =
        Pattern.compile("Bearer\\s+[A-Za-z0-9\\-._~+/]+=*", Pattern.CASE_INSENSITIVE);

    private static final Pattern SECRET_PARAM_PATTERN =
        Pattern.compile("(api[_-]?key|apikey|access[_-]?token|token|password|passwd|pwd|secret)=[^&\\s]+",
            Pattern.CASE_INSENSITIVE);

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public void record(ResilienceEvent event) {
        try {
            audit.info("[AUDIT] {}", toJson(event));
        } catch (JsonProcessingException e) {
            log.warn("[AuditSink] Failed to serialize {} event for {}: {}",
                event.type().eventName(), event.subjectId(), e.getMessage());
        }
    }

    /**
     * Render an event as a single-line JSON object.
     */
    public String toJson(ResilienceEvent event) throws JsonProcessingException {
        ObjectNode node = mapper.createObjectNode();
        node.put("event", event.type().eventName());
        node.put("subject", event.subjectId());
        node.put("timestamp", event.timestamp() != null ? event.timestamp().toString() : null);

        ObjectNode payload = node.putObject("payload");
        for (Map.Entry<String, Object> entry : event.payload().entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String) {
                payload.put(entry.getKey(), sanitize((String) value));
            } else {
                payload.set(entry.getKey(), mapper.valueToTree(value));
            }
        }
        return mapper.writeValueAsString(node);
    }

    /**
     * Mask credentials that may appear in error messages or endpoints.
     */
    public static String sanitize(String input) {
        if (input == null || input.isBlank()) {
            return input;
        }
        String result = BEARER_TOKEN_PATTERN.matcher(input).replaceAll("Bearer ****");
        return SECRET_PARAM_PATTERN.matcher(result).replaceAll("$1=****");
    }
}
