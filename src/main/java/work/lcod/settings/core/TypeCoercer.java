package work.lcod.settings.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.lcod.settings.runtime.VariableType;

/**
 * Converts raw backend values into the Java shape of a {@link VariableType}.
 * <p>
 * Coercion never fails: unparsable numbers become zero, unparsable maps become empty.
 */
public final class TypeCoercer {
    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final Set<String> TRUTHY = Set.of("true", "1", "yes", "on");
    private static final Pattern INTEGER_PREFIX = Pattern.compile("^\\s*([+-]?\\d+(?:_\\d+)*)");
    private static final Pattern FLOAT_PREFIX = Pattern.compile(
        "^\\s*([+-]?(?:\\d+(?:_\\d+)*)?(?:\\.\\d+(?:_\\d+)*)?)(?:[eE]([+-]?\\d+))?");
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private TypeCoercer() {}

    /**
     * Coerces a non-null raw value. Callers handle absence (and defaults) before calling this.
     */
    public static Object coerce(Object raw, VariableType type) {
        if (raw == null) {
            throw new IllegalArgumentException("raw value must not be null; absent values resolve to the default");
        }
        return switch (type) {
            case STRING -> String.valueOf(raw);
            case INTEGER -> raw instanceof Number n ? toLong(n) : parseInteger(String.valueOf(raw));
            case FLOAT -> raw instanceof Number n ? Double.valueOf(n.doubleValue()) : parseFloat(String.valueOf(raw));
            case BOOLEAN -> raw instanceof Boolean b ? b : parseBoolean(String.valueOf(raw));
            case ARRAY -> raw instanceof List<?> list
                ? Collections.unmodifiableList(new ArrayList<Object>(list))
                : parseArray(String.valueOf(raw));
            case MAP -> raw instanceof Map<?, ?> map ? copyMap(map) : parseMap(String.valueOf(raw));
            case SYMBOL -> raw instanceof Symbol symbol ? symbol : Symbol.of(String.valueOf(raw));
        };
    }

    public static boolean parseBoolean(String text) {
        return TRUTHY.contains(text.toLowerCase(Locale.ROOT));
    }

    /**
     * Leading-digits integer parse: {@code "42abc"} is 42, {@code "abc"} is 0. Out-of-range values saturate.
     */
    public static Long parseInteger(String text) {
        Matcher matcher = INTEGER_PREFIX.matcher(text);
        if (!matcher.find()) {
            return 0L;
        }
        BigInteger value = new BigInteger(stripSign(matcher.group(1).replace("_", "")));
        if (value.compareTo(LONG_MAX) > 0) {
            return Long.MAX_VALUE;
        }
        if (value.compareTo(LONG_MIN) < 0) {
            return Long.MIN_VALUE;
        }
        return value.longValue();
    }

    /**
     * Leading-number decimal parse with the same zero-on-failure policy as {@link #parseInteger(String)}.
     */
    public static Double parseFloat(String text) {
        Matcher matcher = FLOAT_PREFIX.matcher(text);
        if (!matcher.find()) {
            return 0.0;
        }
        String mantissa = matcher.group(1).replace("_", "");
        String digits = mantissa.replace("+", "").replace("-", "").replace(".", "");
        if (digits.isEmpty()) {
            return 0.0;
        }
        String exponent = matcher.group(2);
        String literal = exponent == null ? mantissa : mantissa + "e" + exponent;
        try {
            return Double.parseDouble(literal);
        } catch (NumberFormatException ex) {
            return 0.0;
        }
    }

    /**
     * JSON array first, otherwise comma separated with each segment trimmed.
     */
    public static List<Object> parseArray(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        Object parsed = readJson(text);
        if (parsed instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<>(list));
        }
        String[] segments = text.split(",");
        List<Object> values = new ArrayList<>(segments.length);
        for (String segment : segments) {
            values.add(segment.strip());
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * JSON object, otherwise an empty map. There is no key=value fallback.
     */
    public static Map<String, Object> parseMap(String text) {
        if (text.isEmpty()) {
            return Map.of();
        }
        Object parsed = readJson(text);
        if (parsed instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        return Map.of();
    }

    private static Object readJson(String text) {
        try {
            return JSON.readValue(text, Object.class);
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    private static Map<String, Object> copyMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return Collections.unmodifiableMap(copy);
    }

    private static Long toLong(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return (long) number.doubleValue();
        }
        if (number instanceof BigInteger big) {
            return parseInteger(big.toString());
        }
        return number.longValue();
    }

    private static String stripSign(String digits) {
        return digits.startsWith("+") ? digits.substring(1) : digits;
    }
}
