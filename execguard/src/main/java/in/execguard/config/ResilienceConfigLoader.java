package in.execguard.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.execguard.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link ResilienceConfig}.
 *
 * Resolution order (later wins):
 * 1. {@link ResilienceConfig#defaults()}
 * 2. JSON file: {@code EXECGUARD_CONFIG} path if set, else {@code execguard.json} on the classpath
 * 3. Environment variables / system properties, e.g. {@code EXECGUARD_MAX_RETRY_ATTEMPTS=8}
 *
 * Fields missing from the JSON keep their default values.
 */
public final class ResilienceConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ResilienceConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "execguard.json";
    public static final String CONFIG_PATH_ENV = "EXECGUARD_CONFIG";

    // env key -> {section, field}
    private static final Map<String, String[]> OVERRIDES = Map.ofEntries(
        Map.entry("EXECGUARD_INITIAL_BACKOFF_MS", new String[]{"recovery", "initialBackoffMs"}),
        Map.entry("EXECGUARD_MAX_BACKOFF_MS", new String[]{"recovery", "maxBackoffMs"}),
        Map.entry("EXECGUARD_BACKOFF_MULTIPLIER", new String[]{"recovery", "backoffMultiplier"}),
        Map.entry("EXECGUARD_MAX_RETRY_ATTEMPTS", new String[]{"recovery", "maxRetryAttempts"}),
        Map.entry("EXECGUARD_CONNECTION_TIMEOUT_MS", new String[]{"recovery", "connectionTimeoutMs"}),
        Map.entry("EXECGUARD_JITTER_MS", new String[]{"recovery", "jitterMs"}),
        Map.entry("EXECGUARD_MAX_PING_AGE_MS", new String[]{"recovery", "maxPingAgeMs"}),
        Map.entry("EXECGUARD_VALIDATION_POLICY", new String[]{"recovery", "validationPolicy"}),
        Map.entry("EXECGUARD_BRIDGE_INSTANCE_ID", new String[]{"failover", "bridgeInstanceId"}),
        Map.entry("EXECGUARD_EXECUTION_TIMEOUT_MS", new String[]{"failover", "executionTimeoutMs"}),
        Map.entry("EXECGUARD_DIRECT_TIMEOUT_MS", new String[]{"failover", "directTimeoutMs"}),
        Map.entry("EXECGUARD_HEALTH_CHECK_INTERVAL_MS", new String[]{"failover", "healthCheckIntervalMs"}),
        Map.entry("EXECGUARD_SYNC_INTERVAL_MS", new String[]{"sync", "syncIntervalMs"}),
        Map.entry("EXECGUARD_STATE_TIMEOUT_MS", new String[]{"sync", "stateTimeoutMs"}),
        Map.entry("EXECGUARD_PNL_TOLERANCE", new String[]{"sync", "pnlTolerance"}),
        Map.entry("EXECGUARD_TRADE_COUNT_TOLERANCE", new String[]{"sync", "tradeCountTolerance"}),
        Map.entry("EXECGUARD_TIMESTAMP_TOLERANCE_MS", new String[]{"sync", "timestampToleranceMs"}),
        Map.entry("EXECGUARD_PARAMETER_TOLERANCE", new String[]{"sync", "parameterTolerance"}),
        Map.entry("EXECGUARD_CHECK_INTERVAL_MS", new String[]{"consistency", "checkIntervalMs"}),
        Map.entry("EXECGUARD_AUTO_CORRECT", new String[]{"consistency", "autoCorrect"}),
        Map.entry("EXECGUARD_STATUS_ENABLED", new String[]{"status", "enabled"}),
        Map.entry("EXECGUARD_STATUS_HOST", new String[]{"status", "host"}),
        Map.entry("EXECGUARD_STATUS_PORT", new String[]{"status", "port"})
    );

    private final ObjectMapper mapper;

    public ResilienceConfigLoader() {
        this.mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Load from {@code EXECGUARD_CONFIG} or the classpath, apply overrides and validate.
     *
     * @throws IllegalStateException if the resulting configuration is invalid
     */
    public ResilienceConfig load() {
        String path = Env.get(CONFIG_PATH_ENV, null);
        if (path != null) {
            return load(Path.of(path));
        }
        try (InputStream in = ResilienceConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.info("[ConfigLoader] No {} on classpath, using defaults", DEFAULT_RESOURCE);
                return finish(mapper.valueToTree(ResilienceConfig.defaults()));
            }
            log.info("[ConfigLoader] Loading {} from classpath", DEFAULT_RESOURCE);
            return finish(merge(mapper.readTree(in)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public ResilienceConfig load(Path file) {
        try {
            log.info("[ConfigLoader] Loading configuration from {}", file);
            return finish(merge(mapper.readTree(Files.readString(file))));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration " + file, e);
        }
    }

    /**
     * Parse a JSON document (overrides still apply).
     */
    public ResilienceConfig parse(String json) {
        try {
            return finish(merge(mapper.readTree(json)));
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed configuration JSON: " + e.getMessage(), e);
        }
    }

    private ObjectNode merge(JsonNode overlay) {
        ObjectNode base = mapper.valueToTree(ResilienceConfig.defaults());
        if (overlay != null && overlay.isObject()) {
            deepMerge(base, (ObjectNode) overlay);
        }
        return base;
    }

    private static void deepMerge(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                deepMerge((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }

    private ResilienceConfig finish(ObjectNode tree) throws IOException {
        applyOverrides(tree);
        ResilienceConfig config = mapper.treeToValue(tree, ResilienceConfig.class);
        List<String> issues = config.validate();
        if (!issues.isEmpty()) {
            throw new IllegalStateException("Invalid resilience configuration: " + String.join(", ", issues));
        }
        return config;
    }

    private void applyOverrides(ObjectNode tree) {
        for (Map.Entry<String, String[]> entry : OVERRIDES.entrySet()) {
            String value = Env.get(entry.getKey(), null);
            if (value == null) {
                continue;
            }
            String section = entry.getValue()[0];
            String field = entry.getValue()[1];
            ObjectNode node = (ObjectNode) tree.get(section);
            JsonNode current = node.get(field);
            try {
                if (current != null && current.isBoolean()) {
                    node.put(field, "true".equalsIgnoreCase(value) || "1".equals(value));
                } else if (current != null && current.isIntegralNumber()) {
                    node.put(field, Long.parseLong(value.trim()));
                } else if (current != null && current.isNumber()) {
                    node.put(field, Double.parseDouble(value.trim()));
                } else {
                    node.put(field, value);
                }
                log.info("[ConfigLoader] Override {}.{} from {}", section, field, entry.getKey());
            } catch (NumberFormatException e) {
                log.warn("[ConfigLoader] Ignoring non-numeric {}={}", entry.getKey(), value);
            }
        }
    }
}
