package work.lcod.settings.validation;

import java.util.List;

/**
 * Capability that turns a value and its rules into human-readable violations.
 */
public interface ValidationEngine {
    boolean supports(String rule);

    /**
     * Checks a rule set at declaration time.
     *
     * @throws IllegalArgumentException for unknown rule names or malformed parameters
     */
    void verify(String variable, ValidationRules rules);

    /**
     * Evaluates every rule in declaration order; one message per violation, empty when valid.
     */
    List<String> validate(String variable, Object value, ValidationRules rules, FieldLookup fields);
}
