package work.lcod.settings.validation;

/**
 * Minimal engine: presence, length, format and inclusion. Any other rule name is rejected at declaration.
 */
public final class BuiltinValidationEngine extends RuleBasedValidationEngine {
    public BuiltinValidationEngine() {
        BaseRules.registerAll(this);
    }
}
