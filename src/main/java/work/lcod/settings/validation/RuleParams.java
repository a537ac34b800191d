package work.lcod.settings.validation;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Helpers to read rule parameters supplied as plain maps (builder, manifests, hand-written maps).
 */
final class RuleParams {
    private RuleParams() {}

    static boolean enabled(Object params) {
        return !Boolean.FALSE.equals(params);
    }

    static Map<?, ?> options(String rule, Object params) {
        if (params instanceof Map<?, ?> map) {
            return map;
        }
        throw new IllegalArgumentException(rule + " expects a map of options, got: " + params);
    }

    static Object first(Map<?, ?> options, String... keys) {
        for (String key : keys) {
            if (options.containsKey(key)) {
                return options.get(key);
            }
        }
        return null;
    }

    static Long integer(String rule, String key, Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            return number.longValue();
        }
        throw new IllegalArgumentException(rule + "." + key + " must be a number, got: " + raw);
    }

    static long[] range(String rule, Object raw) {
        if (raw instanceof List<?> list && list.size() == 2
            && list.get(0) instanceof Number from && list.get(1) instanceof Number to) {
            return new long[] { from.longValue(), to.longValue() };
        }
        throw new IllegalArgumentException(rule + " range must be a two-element list [min, max], got: " + raw);
    }

    static Collection<?> collection(String rule, Object params) {
        if (params instanceof Collection<?> values) {
            return values;
        }
        if (params instanceof Map<?, ?> map) {
            Object values = first(map, "in", "set", "within");
            if (values instanceof Collection<?> collection) {
                return collection;
            }
        }
        throw new IllegalArgumentException(rule + " expects a collection under 'in', got: " + params);
    }

    static Pattern pattern(String rule, Object raw) {
        if (raw instanceof Pattern pattern) {
            return pattern;
        }
        if (raw instanceof String regex && !regex.isEmpty()) {
            return Pattern.compile(regex);
        }
        throw new IllegalArgumentException(rule + " expects a pattern under 'with', got: " + raw);
    }

    /**
     * Custom message override ({@code message} option) or {@code null}.
     */
    static String message(Object params) {
        if (params instanceof Map<?, ?> map && map.get("message") instanceof String message && !message.isBlank()) {
            return message;
        }
        return null;
    }
}
