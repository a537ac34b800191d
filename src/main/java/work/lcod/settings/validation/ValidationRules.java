package work.lcod.settings.validation;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Ordered rule name to parameters mapping attached to a variable. Rules are evaluated in insertion order.
 */
public final class ValidationRules {
    private static final ValidationRules NONE = new ValidationRules(Map.of());

    private final Map<String, Object> rules;

    private ValidationRules(Map<String, Object> rules) {
        this.rules = rules;
    }

    public static ValidationRules none() {
        return NONE;
    }

    public static ValidationRules of(Map<String, ?> rules) {
        if (rules == null || rules.isEmpty()) {
            return NONE;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        rules.forEach((name, params) -> {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("validation rule name is required");
            }
            copy.put(name, Objects.requireNonNull(params, () -> "parameters for rule '" + name + "'"));
        });
        return new ValidationRules(Collections.unmodifiableMap(copy));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public Set<String> names() {
        return rules.keySet();
    }

    public Object params(String rule) {
        return rules.get(rule);
    }

    public Map<String, Object> asMap() {
        return rules;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ValidationRules that && rules.equals(that.rules);
    }

    @Override
    public int hashCode() {
        return rules.hashCode();
    }

    @Override
    public String toString() {
        return rules.toString();
    }

    public static final class Builder {
        private final Map<String, Object> rules = new LinkedHashMap<>();

        private Builder() {}

        public Builder presence() {
            return rule("presence", true);
        }

        public Builder absence() {
            return rule("absence", true);
        }

        public Builder length(int minimum, int maximum) {
            return rule("length", Map.of("minimum", minimum, "maximum", maximum));
        }

        public Builder minimumLength(int minimum) {
            return rule("length", Map.of("minimum", minimum));
        }

        public Builder maximumLength(int maximum) {
            return rule("length", Map.of("maximum", maximum));
        }

        public Builder lengthRange(int from, int to) {
            return rule("length", Map.of("in", List.of(from, to)));
        }

        public Builder format(String regex) {
            return rule("format", Map.of("with", Pattern.compile(regex)));
        }

        public Builder format(Pattern pattern, String message) {
            if (message == null) {
                return rule("format", Map.of("with", pattern));
            }
            return rule("format", Map.of("with", pattern, "message", message));
        }

        public Builder inclusion(Collection<?> allowed) {
            return rule("inclusion", Map.of("in", List.copyOf(allowed)));
        }

        public Builder exclusion(Collection<?> reserved) {
            return rule("exclusion", Map.of("in", List.copyOf(reserved)));
        }

        public Builder numericality(Map<String, ?> options) {
            return rule("numericality", Map.copyOf(options));
        }

        public Builder comparison(Map<String, ?> options) {
            return rule("comparison", Map.copyOf(options));
        }

        public Builder rule(String name, Object params) {
            rules.put(name, params);
            return this;
        }

        public ValidationRules build() {
            return ValidationRules.of(rules);
        }
    }
}
