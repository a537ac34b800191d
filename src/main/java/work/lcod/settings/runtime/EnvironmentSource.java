package work.lcod.settings.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Implicit read backend consulted when neither a variable nor the registry provides a reader.
 */
@FunctionalInterface
public interface EnvironmentSource {
    String lookup(String key);

    static EnvironmentSource system() {
        return System::getenv;
    }

    static EnvironmentSource of(Map<String, String> values) {
        Map<String, String> copy = Map.copyOf(Objects.requireNonNull(values, "values"));
        return copy::get;
    }

    /**
     * Returns a source where {@code overrides} win over this one.
     */
    default EnvironmentSource overlay(Map<String, String> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, String> copy = new LinkedHashMap<>(overrides);
        return key -> copy.containsKey(key) ? copy.get(key) : lookup(key);
    }
}
