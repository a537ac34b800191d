package work.lcod.settings.runtime;

/**
 * Raised when an operation names a variable that was never declared.
 */
public final class UnknownVariableException extends SettingsException {
    private final String name;

    public UnknownVariableException(String name) {
        super("Unknown variable '" + name + "': declare it before reading or writing.");
        this.name = name;
    }

    public String name() {
        return name;
    }
}
