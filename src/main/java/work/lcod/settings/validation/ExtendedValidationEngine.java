package work.lcod.settings.validation;

import java.util.Objects;

/**
 * Rich engine: the base rules plus numericality, comparison, exclusion, absence and
 * user-registered validators.
 */
public final class ExtendedValidationEngine extends RuleBasedValidationEngine {
    public ExtendedValidationEngine() {
        BaseRules.registerAll(this);
        ExtendedRules.registerAll(this);
    }

    /**
     * Adds (or replaces) a named rule. Register custom rules before declaring variables that use them.
     */
    public ExtendedValidationEngine register(String rule, CustomValidator validator) {
        Objects.requireNonNull(validator, "validator");
        registerEvaluator(rule, (context, params) -> validator.validate(context.value(), params));
        return this;
    }
}
