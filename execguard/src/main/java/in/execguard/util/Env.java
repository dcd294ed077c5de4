package in.execguard.util;

/**
 * Environment variable utilities.
 *
 * Environment variables win over system properties of the same name.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    private Env() {}
}
