package work.lcod.settings.runtime;

/**
 * Raised when a write has no writer to go to. Variables are read-only unless a writer is configured.
 */
public final class ReadOnlyException extends SettingsException {
    private final String name;

    public ReadOnlyException(String name) {
        super("Cannot write to '" + name + "': variable is read-only. Provide a writer callback to enable writing.");
        this.name = name;
    }

    public String name() {
        return name;
    }
}
