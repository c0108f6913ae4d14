package in.tradecore.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Environment overrides. An environment variable wins; a JVM system property of the same
 * name is the fallback, so tests can set values without touching the process environment.
 */
public final class Env {

    public static Optional<String> find(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    public static int getInt(String key, int defaultValue) {
        Optional<String> value = find(key);
        if (value.isEmpty()) return defaultValue;
        try {
            return Integer.parseInt(value.get());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + ": " + value.get(), e);
        }
    }

    public static Optional<Boolean> findBool(String key) {
        return find(key).map(v -> "true".equalsIgnoreCase(v) || "1".equals(v) || "yes".equalsIgnoreCase(v));
    }

    public static <E extends Enum<E>> Optional<E> findEnum(String key, Class<E> type) {
        Optional<String> value = find(key);
        if (value.isEmpty()) return Optional.empty();
        try {
            return Optional.of(Enum.valueOf(type, value.get().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid " + key + ": " + value.get(), e);
        }
    }

    public static Optional<Path> findPath(String key) {
        return find(key).map(Path::of);
    }

    private Env() {}
}
