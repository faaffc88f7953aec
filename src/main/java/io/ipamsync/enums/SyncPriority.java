package io.ipamsync.enums;

import java.util.Locale;

/**
 * Sync priority class of an integrator. Each scheduler instance serves one class.
 */
public enum SyncPriority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    SyncPriority(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @throws IllegalArgumentException if the value is not a known priority
     */
    public static SyncPriority fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Sync priority cannot be null");
        }
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        for (SyncPriority priority : values()) {
            if (priority.value.equals(trimmed)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown sync priority: " + value);
    }
}
