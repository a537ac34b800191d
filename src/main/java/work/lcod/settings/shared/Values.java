package work.lcod.settings.shared;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Value helpers used by validation and presence checks.
 */
public final class Values {
    private Values() {}

    /**
     * String form used by length/format rules and presence checks; {@code null} stays {@code null}.
     */
    public static String stringForm(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    public static boolean isBlank(Object value) {
        return value == null || String.valueOf(value).isEmpty();
    }

    /**
     * Equality that compares numbers by value, so {@code 3}, {@code 3L} and {@code 3.0} are the same.
     */
    public static boolean sameValue(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            BigDecimal x = toBigDecimal(a);
            BigDecimal y = toBigDecimal(b);
            if (x != null && y != null) {
                return x.compareTo(y) == 0;
            }
        }
        return left == null ? right == null : left.equals(right);
    }

    public static boolean contains(Collection<?> candidates, Object value) {
        for (Object candidate : candidates) {
            if (sameValue(candidate, value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Converts finite numbers to {@link BigDecimal}; returns {@code null} for NaN/infinite doubles.
     */
    public static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d);
        }
        if (number instanceof java.math.BigInteger big) {
            return new BigDecimal(big);
        }
        return BigDecimal.valueOf(number.longValue());
    }

    /**
     * Prints a bound the way messages quote it: integral decimals without a trailing {@code .0}.
     */
    public static String describe(Object value) {
        if (value instanceof Double d && !d.isNaN() && !d.isInfinite() && d == Math.rint(d)
            && Math.abs(d) < 1e15) {
            return String.valueOf(d.longValue());
        }
        return String.valueOf(value);
    }
}
