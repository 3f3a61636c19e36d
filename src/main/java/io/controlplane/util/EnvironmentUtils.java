package io.controlplane.util;

import java.util.function.Function;

/**
 * Utility class for environment variable operations
 */
public final class EnvironmentUtils {

    private EnvironmentUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Get environment variable with default value.
     * Blank values are treated as unset.
     *
     * @param env the lookup to read from (usually {@code System::getenv})
     * @param name the environment variable name
     * @param defaultValue the default value to return if not set
     * @return the trimmed environment variable value or default if not set
     */
    public static String getEnv(Function<String, String> env, String name, String defaultValue) {
        String value = env.apply(name);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    /**
     * Get an integer environment variable, falling back to the default when the
     * variable is unset or not a valid integer.
     */
    public static Integer getIntEnv(Function<String, String> env, String name, Integer defaultValue) {
        String value = getEnv(env, name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
