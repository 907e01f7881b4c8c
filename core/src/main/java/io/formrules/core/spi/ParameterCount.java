package io.formrules.core.spi;

/**
 * Number of parameters a {@link Rule} accepts, checked when a rule set is built.
 *
 * @param min minimum parameter count (inclusive)
 * @param max maximum parameter count (inclusive), {@link Integer#MAX_VALUE} for unbounded
 */
public record ParameterCount(int min, int max) {

    public ParameterCount {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid parameter count range: " + min + ".." + max);
        }
    }

    public static ParameterCount none() {
        return new ParameterCount(0, 0);
    }

    public static ParameterCount any() {
        return new ParameterCount(0, Integer.MAX_VALUE);
    }

    public static ParameterCount exactly(int count) {
        return new ParameterCount(count, count);
    }

    public static ParameterCount atLeast(int count) {
        return new ParameterCount(count, Integer.MAX_VALUE);
    }

    public static ParameterCount atMost(int count) {
        return new ParameterCount(0, count);
    }

    /** Returns {@code true} if {@code count} parameters are acceptable. */
    public boolean accepts(int count) {
        return count >= min && count <= max;
    }

    /** Human-readable form used in error messages, e.g. "exactly 2" or "at least 1". */
    public String describe() {
        if (min == max) {
            return "exactly " + min;
        }
        if (max == Integer.MAX_VALUE) {
            return "at least " + min;
        }
        return "between " + min + " and " + max;
    }
}
