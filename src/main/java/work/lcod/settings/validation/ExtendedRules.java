package work.lcod.settings.validation;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;
import work.lcod.settings.core.Symbol;
import work.lcod.settings.shared.Values;

/**
 * Rich rules: numericality, comparison, exclusion and absence.
 */
final class ExtendedRules {
    private ExtendedRules() {}

    enum Operator {
        GREATER_THAN("greater_than", "must be greater than ", cmp -> cmp > 0),
        GREATER_THAN_OR_EQUAL_TO("greater_than_or_equal_to", "must be greater than or equal to ", cmp -> cmp >= 0),
        EQUAL_TO("equal_to", "must be equal to ", cmp -> cmp == 0),
        LESS_THAN("less_than", "must be less than ", cmp -> cmp < 0),
        LESS_THAN_OR_EQUAL_TO("less_than_or_equal_to", "must be less than or equal to ", cmp -> cmp <= 0),
        OTHER_THAN("other_than", "must be other than ", cmp -> cmp != 0);

        private final String key;
        private final String message;
        private final IntPredicate accepts;

        Operator(String key, String message, IntPredicate accepts) {
            this.key = key;
            this.message = message;
            this.accepts = accepts;
        }
    }

    static void registerAll(RuleBasedValidationEngine engine) {
        engine.registerEvaluator("numericality", NUMERICALITY);
        engine.registerEvaluator("comparison", COMPARISON);
        engine.registerEvaluator("exclusion", EXCLUSION);
        engine.registerEvaluator("absence", ExtendedRules::absence);
    }

    static List<String> absence(RuleContext context, Object params) {
        if (RuleParams.enabled(params) && !Values.isBlank(context.value())) {
            return List.of("must be blank");
        }
        return List.of();
    }

    static final RuleEvaluator NUMERICALITY = new RuleEvaluator() {
        @Override
        public List<String> evaluate(RuleContext context, Object params) {
            Map<?, ?> options = params instanceof Map<?, ?> map ? map : Map.of();
            if (context.value() == null && Boolean.TRUE.equals(options.get("allow_nil"))) {
                return List.of();
            }
            BigDecimal number = asNumber(context.value());
            if (number == null) {
                return List.of("is not a number");
            }
            boolean integral = number.stripTrailingZeros().scale() <= 0;
            if (Boolean.TRUE.equals(options.get("only_integer")) && !integral) {
                return List.of("must be an integer");
            }
            List<String> messages = new ArrayList<>();
            for (Operator operator : Operator.values()) {
                if (!options.containsKey(operator.key)) {
                    continue;
                }
                Object bound = resolveBound(context, options.get(operator.key));
                if (bound == null) {
                    continue;
                }
                BigDecimal limit = asNumber(bound);
                if (limit == null) {
                    throw new IllegalArgumentException(
                        "numericality." + operator.key + " for '" + context.variable() + "' is not a number: " + bound);
                }
                if (!operator.accepts.test(number.compareTo(limit))) {
                    messages.add(operator.message + Values.describe(bound));
                }
            }
            if (Boolean.TRUE.equals(options.get("odd")) && (!integral || !isOdd(number))) {
                messages.add("must be odd");
            }
            if (Boolean.TRUE.equals(options.get("even")) && (!integral || isOdd(number))) {
                messages.add("must be even");
            }
            return messages;
        }

        @Override
        public void verify(String rule, Object params) {
            if (!(params instanceof Map<?, ?>) && !Boolean.TRUE.equals(params)) {
                throw new IllegalArgumentException(rule + " expects true or a map of options, got: " + params);
            }
        }
    };

    static final RuleEvaluator COMPARISON = new RuleEvaluator() {
        @Override
        public List<String> evaluate(RuleContext context, Object params) {
            if (context.value() == null) {
                return List.of();
            }
            Map<?, ?> options = RuleParams.options("comparison", params);
            List<String> messages = new ArrayList<>();
            for (Operator operator : Operator.values()) {
                if (!options.containsKey(operator.key)) {
                    continue;
                }
                Object bound = resolveBound(context, options.get(operator.key));
                if (bound == null) {
                    continue;
                }
                Integer cmp = compare(context.value(), bound);
                if (cmp == null) {
                    messages.add("can't be compared to " + Values.describe(bound));
                } else if (!operator.accepts.test(cmp)) {
                    messages.add(operator.message + Values.describe(bound));
                }
            }
            return messages;
        }

        @Override
        public void verify(String rule, Object params) {
            Map<?, ?> options = RuleParams.options(rule, params);
            for (Operator operator : Operator.values()) {
                if (options.containsKey(operator.key)) {
                    return;
                }
            }
            throw new IllegalArgumentException(rule + " needs at least one comparison operator");
        }
    };

    static final RuleEvaluator EXCLUSION = new RuleEvaluator() {
        @Override
        public List<String> evaluate(RuleContext context, Object params) {
            if (context.value() != null && Values.contains(RuleParams.collection("exclusion", params), context.value())) {
                return List.of("is reserved");
            }
            return List.of();
        }

        @Override
        public void verify(String rule, Object params) {
            RuleParams.collection(rule, params);
        }
    };

    /**
     * A bound naming another declared variable resolves to that variable's current value.
     */
    private static Object resolveBound(RuleContext context, Object bound) {
        String reference = bound instanceof Symbol symbol ? symbol.name() : bound instanceof String s ? s : null;
        if (reference != null && context.fields().isDeclared(reference)) {
            return context.fields().valueOf(reference);
        }
        return bound;
    }

    private static BigDecimal asNumber(Object value) {
        if (value instanceof Number number) {
            return Values.toBigDecimal(number);
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static Integer compare(Object value, Object bound) {
        if (value instanceof Number && bound instanceof Number) {
            BigDecimal left = asNumber(value);
            BigDecimal right = asNumber(bound);
            return left == null || right == null ? null : left.compareTo(right);
        }
        if (value instanceof Comparable<?> comparable && value.getClass().isInstance(bound)) {
            return compareSameClass(comparable, bound);
        }
        return null;
    }

    /**
     * Only called when {@code bound} is an instance of {@code value}'s class.
     */
    @SuppressWarnings("unchecked")
    private static <T> int compareSameClass(Comparable<T> value, Object bound) {
        return value.compareTo((T) bound);
    }

    private static boolean isOdd(BigDecimal integral) {
        return integral.toBigInteger().testBit(0);
    }
}
