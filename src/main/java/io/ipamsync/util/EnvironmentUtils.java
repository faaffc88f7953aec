package io.ipamsync.util;

/**
 * Utility class for environment variable operations
 */
public final class EnvironmentUtils {

    private EnvironmentUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Get environment variable with default value. Blank values count as unset.
     *
     * @param name the environment variable name
     * @param defaultValue the default value to return if not set
     * @return the environment variable value or default if not set
     */
    public static String getEnv(String name, String defaultValue) {
        String value = System.getenv(name);
        return isBlank(value) ? defaultValue : value.trim();
    }

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
