package work.lcod.settings.manifest;

import work.lcod.settings.runtime.SettingsException;

/**
 * Raised when a declaration manifest cannot be read or is malformed.
 */
public final class ManifestException extends SettingsException {
    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
