package in.execguard.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * HTTP status endpoint settings.
 */
public record StatusConfig(
    @JsonProperty("enabled")
    boolean enabled,

    @JsonProperty("host")
    String host,

    @JsonProperty("port")
    int port
) {
    public static StatusConfig defaults() {
        return new StatusConfig(false, "0.0.0.0", 9095);
    }

    List<String> validate() {
        List<String> issues = new ArrayList<>();
        if (enabled && (port <= 0 || port > 65535)) issues.add("status.port must be between 1 and 65535");
        return issues;
    }
}
