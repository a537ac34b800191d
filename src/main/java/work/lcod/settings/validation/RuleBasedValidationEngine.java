package work.lcod.settings.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validation engine backed by a table of named {@link RuleEvaluator}s.
 */
public abstract class RuleBasedValidationEngine implements ValidationEngine {
    private final Map<String, RuleEvaluator> evaluators = new ConcurrentHashMap<>();

    protected final void registerEvaluator(String rule, RuleEvaluator evaluator) {
        if (rule == null || rule.isBlank()) {
            throw new IllegalArgumentException("rule name is required");
        }
        evaluators.put(rule, Objects.requireNonNull(evaluator, "evaluator"));
    }

    @Override
    public boolean supports(String rule) {
        return rule != null && evaluators.containsKey(rule);
    }

    @Override
    public void verify(String variable, ValidationRules rules) {
        for (var entry : rules.asMap().entrySet()) {
            evaluatorFor(variable, entry.getKey()).verify(entry.getKey(), entry.getValue());
        }
    }

    @Override
    public List<String> validate(String variable, Object value, ValidationRules rules, FieldLookup fields) {
        if (rules == null || rules.isEmpty()) {
            return List.of();
        }
        var context = new RuleContext(variable, value, fields);
        List<String> messages = new ArrayList<>();
        for (var entry : rules.asMap().entrySet()) {
            RuleEvaluator evaluator = evaluatorFor(variable, entry.getKey());
            List<String> suffixes = evaluator.evaluate(context, entry.getValue());
            if (suffixes.isEmpty()) {
                continue;
            }
            String override = RuleParams.message(entry.getValue());
            for (String suffix : suffixes) {
                messages.add(context.displayName() + " " + (override != null ? override : suffix));
            }
        }
        return messages;
    }

    private RuleEvaluator evaluatorFor(String variable, String rule) {
        RuleEvaluator evaluator = evaluators.get(rule);
        if (evaluator == null) {
            throw new IllegalArgumentException(
                "Unsupported validation rule '" + rule + "' for '" + variable + "' (engine: "
                    + getClass().getSimpleName() + ")"
            );
        }
        return evaluator;
    }
}
