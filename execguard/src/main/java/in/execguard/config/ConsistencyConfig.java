package in.execguard.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Consistency sweep settings.
 */
public record ConsistencyConfig(
    @JsonProperty("checkIntervalMs")
    long checkIntervalMs,

    @JsonProperty("autoCorrect")
    boolean autoCorrect
) {
    public static ConsistencyConfig defaults() {
        return new ConsistencyConfig(60_000, true);
    }

    List<String> validate() {
        List<String> issues = new ArrayList<>();
        if (checkIntervalMs <= 0) issues.add("consistency.checkIntervalMs must be positive");
        return issues;
    }
}
