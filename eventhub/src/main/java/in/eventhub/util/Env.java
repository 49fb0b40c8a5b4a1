package in.eventhub.util;

import java.time.Duration;

/**
 * Environment variable utilities.
 * Lookup order: environment variable, then system property, then default.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static Duration getSeconds(String key, Duration defaultValue) {
        int seconds = getInt(key, -1);
        return seconds < 0 ? defaultValue : Duration.ofSeconds(seconds);
    }

    private Env() {}
}
