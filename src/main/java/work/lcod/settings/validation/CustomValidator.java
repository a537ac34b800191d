package work.lcod.settings.validation;

import java.util.List;

/**
 * User-supplied rule registered on an {@link ExtendedValidationEngine}.
 */
@FunctionalInterface
public interface CustomValidator {
    /**
     * @return message suffixes, e.g. {@code "must be a valid URL"}; empty when the value passes
     */
    List<String> validate(Object value, Object params);
}
