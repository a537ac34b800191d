package work.lcod.settings.shared;

import java.util.Locale;

/**
 * Naming helpers shared by the registry and the validation messages.
 */
public final class Names {
    private Names() {}

    /**
     * Key used against the environment and passed to every reader/writer callback.
     */
    public static String storageKey(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    /**
     * Human-readable label for messages: {@code database_url} becomes {@code Database url}.
     */
    public static String displayName(String name) {
        if (name == null || name.isBlank()) {
            return "Value";
        }
        String spaced = name.trim().replace('_', ' ').toLowerCase(Locale.ROOT);
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }
}
