package work.lcod.settings.runtime;

/**
 * Persists an already validated value to a backend.
 */
@FunctionalInterface
public interface SettingsWriter {
    void write(String storageKey, Object value, VariableSpec spec);
}
