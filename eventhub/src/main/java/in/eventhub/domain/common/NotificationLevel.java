package in.eventhub.domain.common;

import java.util.Locale;

/**
 * Severity of a system notification.
 */
public enum NotificationLevel {
    INFO,
    SUCCESS,
    WARNING,
    ERROR,
    CRITICAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse used for bus and HTTP input; unknown or missing values map to INFO.
     */
    public static NotificationLevel parse(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return INFO;
        }
    }
}
