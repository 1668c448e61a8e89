package com.hcltech.composable.common;

import java.util.Locale;

/**
 * Abstraction for reading environment variables or configuration values.
 * <p>
 * Used to avoid direct calls to {@link System#getenv(String)} in code,
 * so that unit tests can provide their own environment source.
 */
@FunctionalInterface
public interface IEnvGetter {
    /**
     * Default implementation backed by {@link System#getenv(String)}.
     */
    IEnvGetter env = System::getenv;

    /**
     * Returns the value of the given environment variable, or {@code null} if unset.
     */
    String get(String name);

    /**
     * Returns the value of the environment variable, throwing if missing or blank.
     */
    static String getString(IEnvGetter env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required environment variable: " + name);
        }
        return value.trim();
    }

    static String getStringOr(IEnvGetter env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    static boolean getBooleanOr(IEnvGetter env, String name, boolean defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? Boolean.parseBoolean(value.trim()) : defaultValue;
    }

    static int getIntOr(IEnvGetter env, String name, int defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for environment variable: " + name + " = '" + value + "'", e);
        }
    }

    /**
     * Parses an enum constant case-insensitively, falling back to the default when unset.
     */
    static <E extends Enum<E>> E getEnumOr(IEnvGetter env, String name, Class<E> type, E defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid value for environment variable: " + name + " = '" + value + "'", e);
        }
    }
}
