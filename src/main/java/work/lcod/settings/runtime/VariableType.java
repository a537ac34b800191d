package work.lcod.settings.runtime;

import java.util.Locale;

/**
 * Declared type of a variable. Fixed at declaration, never inferred from a value.
 */
public enum VariableType {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    ARRAY,
    MAP,
    SYMBOL;

    public static VariableType from(String value) {
        if (value == null || value.isBlank()) {
            return STRING;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("HASH".equals(normalized)) {
            return MAP;
        }
        try {
            return VariableType.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported variable type: " + value);
        }
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
