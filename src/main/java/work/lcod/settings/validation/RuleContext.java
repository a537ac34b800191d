package work.lcod.settings.validation;

import work.lcod.settings.shared.Names;

/**
 * What a rule evaluator sees: the variable, its resolved value and the other variables.
 */
public record RuleContext(String variable, Object value, FieldLookup fields) {
    public RuleContext {
        fields = fields == null ? FieldLookup.none() : fields;
    }

    public String displayName() {
        return Names.displayName(variable);
    }
}
