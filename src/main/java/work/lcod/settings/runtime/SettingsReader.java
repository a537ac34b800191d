package work.lcod.settings.runtime;

/**
 * Reads the raw value of a variable from a backend.
 */
@FunctionalInterface
public interface SettingsReader {
    /**
     * @param storageKey upper-cased key derived from the variable name
     * @param spec the declared variable; must not be modified
     * @return the raw (usually textual) value, or {@code null} when the backend holds nothing
     */
    Object read(String storageKey, VariableSpec spec);
}
