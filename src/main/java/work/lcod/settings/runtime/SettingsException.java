package work.lcod.settings.runtime;

/**
 * Base type for failures raised by the settings registry.
 */
public class SettingsException extends RuntimeException {
    public SettingsException(String message) {
        super(message);
    }

    public SettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
