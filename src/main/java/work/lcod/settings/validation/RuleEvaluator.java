package work.lcod.settings.validation;

import java.util.List;

/**
 * Evaluates one named rule. Returns message suffixes (without the field name); empty means the rule passed.
 */
@FunctionalInterface
public interface RuleEvaluator {
    List<String> evaluate(RuleContext context, Object params);

    /**
     * Rejects malformed parameters when a variable is declared.
     */
    default void verify(String rule, Object params) {}
}
