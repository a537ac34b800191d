package work.lcod.settings.validation;

import java.util.List;
import work.lcod.settings.runtime.SettingsException;

/**
 * Raised when one or more variables violate their rules. Carries every violation message.
 */
public final class ValidationException extends SettingsException {
    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super(String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
