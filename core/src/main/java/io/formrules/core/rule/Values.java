package io.formrules.core.rule;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/** Conversions between the loosely typed values of a form. */
final class Values {

    private Values() {}

    /** Numeric value of a number or of a string holding a decimal number. */
    static Optional<BigDecimal> toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return Optional.of(decimal);
        }
        if (value instanceof BigInteger integer) {
            return Optional.of(new BigDecimal(integer));
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? Optional.of(BigDecimal.valueOf(d)) : Optional.empty();
        }
        if (value instanceof Number number) {
            return Optional.of(BigDecimal.valueOf(number.longValue()));
        }
        if (value instanceof String text) {
            return parseDecimal(text);
        }
        return Optional.empty();
    }

    static Optional<BigDecimal> parseDecimal(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(trimmed));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Size used by the size rules: the number itself, the code point length of a string, the
     * element count of a list or map.
     */
    static Optional<BigDecimal> size(Object value) {
        if (value instanceof Number) {
            return toDecimal(value);
        }
        if (value instanceof String text) {
            return Optional.of(BigDecimal.valueOf(text.codePointCount(0, text.length())));
        }
        if (value instanceof Collection<?> collection) {
            return Optional.of(BigDecimal.valueOf(collection.size()));
        }
        if (value instanceof Map<?, ?> map) {
            return Optional.of(BigDecimal.valueOf(map.size()));
        }
        return Optional.empty();
    }

    /** String form of a scalar value, empty for null, lists, maps and other objects. */
    static Optional<String> scalarString(Object value) {
        if (value instanceof String text) {
            return Optional.of(text);
        }
        if (value instanceof Boolean bool) {
            return Optional.of(bool.toString());
        }
        if (value instanceof Number) {
            return toDecimal(value).map(decimal -> decimal.stripTrailingZeros().toPlainString());
        }
        return Optional.empty();
    }

    /** Equality across numeric representations: {@code 1}, {@code 1L} and {@code 1.0} are equal. */
    static boolean sameValue(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            Optional<BigDecimal> left = toDecimal(a);
            Optional<BigDecimal> right = toDecimal(b);
            return left.isPresent() && right.isPresent() && left.get().compareTo(right.get()) == 0;
        }
        return a == null ? b == null : a.equals(b);
    }
}
