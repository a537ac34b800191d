package work.lcod.settings.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.lcod.settings.shared.Values;

/**
 * The four base rules: presence, length, format and inclusion.
 * length, format and inclusion ignore {@code null}; presence reports it.
 */
final class BaseRules {
    private BaseRules() {}

    static void registerAll(RuleBasedValidationEngine engine) {
        engine.registerEvaluator("presence", BaseRules::presence);
        engine.registerEvaluator("length", LENGTH);
        engine.registerEvaluator("format", FORMAT);
        engine.registerEvaluator("inclusion", INCLUSION);
    }

    static List<String> presence(RuleContext context, Object params) {
        if (RuleParams.enabled(params) && Values.isBlank(context.value())) {
            return List.of("can't be blank");
        }
        return List.of();
    }

    static final RuleEvaluator LENGTH = new RuleEvaluator() {
        @Override
        public List<String> evaluate(RuleContext context, Object params) {
            if (context.value() == null) {
                return List.of();
            }
            Map<?, ?> options = RuleParams.options("length", params);
            String text = Values.stringForm(context.value());
            int length = text.codePointCount(0, text.length());
            Long minimum = RuleParams.integer("length", "minimum", RuleParams.first(options, "minimum", "min"));
            Long maximum = RuleParams.integer("length", "maximum", RuleParams.first(options, "maximum", "max"));
            Object rangeRaw = RuleParams.first(options, "in", "range", "within");
            if (rangeRaw != null) {
                long[] range = RuleParams.range("length", rangeRaw);
                minimum = range[0];
                maximum = range[1];
            }
            Long exact = RuleParams.integer("length", "is", options.get("is"));
            List<String> messages = new ArrayList<>();
            if (exact != null && length != exact) {
                messages.add("is the wrong length (should be " + exact + " characters)");
            }
            if (minimum != null && length < minimum) {
                messages.add("is too short (minimum is " + minimum + " characters)");
            }
            if (maximum != null && length > maximum) {
                messages.add("is too long (maximum is " + maximum + " characters)");
            }
            return messages;
        }

        @Override
        public void verify(String rule, Object params) {
            Map<?, ?> options = RuleParams.options(rule, params);
            Long minimum = RuleParams.integer(rule, "minimum", RuleParams.first(options, "minimum", "min"));
            Long maximum = RuleParams.integer(rule, "maximum", RuleParams.first(options, "maximum", "max"));
            Long exact = RuleParams.integer(rule, "is", options.get("is"));
            Object rangeRaw = RuleParams.first(options, "in", "range", "within");
            if (rangeRaw != null) {
                RuleParams.range(rule, rangeRaw);
            } else if (minimum == null && maximum == null && exact == null) {
                throw new IllegalArgumentException(rule + " needs minimum, maximum, is or in");
            }
        }
    };

    static final RuleEvaluator FORMAT = new RuleEvaluator() {
        @Override
        public List<String> evaluate(RuleContext context, Object params) {
            if (context.value() == null) {
                return List.of();
            }
            var pattern = RuleParams.pattern("format", patternOption(params));
            if (pattern.matcher(Values.stringForm(context.value())).find()) {
                return List.of();
            }
            return List.of("is invalid");
        }

        @Override
        public void verify(String rule, Object params) {
            RuleParams.pattern(rule, patternOption(params));
        }

        private Object patternOption(Object params) {
            if (params instanceof Map<?, ?> options) {
                return RuleParams.first(options, "with", "pattern");
            }
            return params;
        }
    };

    static final RuleEvaluator INCLUSION = new RuleEvaluator() {
        @Override
        public List<String> evaluate(RuleContext context, Object params) {
            if (context.value() == null) {
                return List.of();
            }
            if (Values.contains(RuleParams.collection("inclusion", params), context.value())) {
                return List.of();
            }
            return List.of("is not included in the list");
        }

        @Override
        public void verify(String rule, Object params) {
            RuleParams.collection(rule, params);
        }
    };
}
