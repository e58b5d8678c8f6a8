package org.scharp.survey;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Conversions of raw answer values that are shared by several field types.
 * <p>
 * The conversion methods return {@code null} when a value cannot be converted.  It's up to the caller to decide if
 * that means the value is absent or invalid.
 * </p>
 */
abstract class ValueUtil {

    private static final Pattern INTEGER_TOKEN = Pattern.compile("[+-]?[0-9]+");

    private static final Pattern DECIMAL_TOKEN = Pattern.compile(
        "[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    // 2^63 as a double.  Every double whose magnitude is below this truncates into a long.
    private static final double LONG_RANGE = 0x1p63;

    /**
     * Determines if a raw value carries no answer.  Blank values are {@code null}, empty strings, empty collections,
     * empty maps and empty {@code Object[]} or {@code int[]} arrays.  Whitespace, numeric zero and {@code false} are
     * not blank.
     *
     * @param value
     *     The value to check.
     *
     * @return {@code true} if {@code value} is blank, {@code false} otherwise.
     */
    static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence charSequence) {
            return charSequence.length() == 0;
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        if (value instanceof Object[] array) {
            return array.length == 0;
        }
        if (value instanceof int[] array) {
            return array.length == 0;
        }
        return false;
    }

    /**
     * Converts a raw value to a {@code long}.
     * <p>
     * Strings must hold a strict integer token (an optional sign followed by decimal digits), optionally surrounded by
     * whitespace, so "15.5" is not converted.  Numbers with a fractional part, on the other hand, are truncated toward
     * zero, so {@code 15.5} becomes {@code 15}.
     * </p>
     *
     * @param value
     *     The raw value.
     *
     * @return The converted value or {@code null} if {@code value} isn't an integer that fits in a {@code long}.
     */
    static Long toLong(Object value) {
        if (value instanceof CharSequence charSequence) {
            String token = charSequence.toString().strip();
            if (!INTEGER_TOKEN.matcher(token).matches()) {
                return null;
            }
            try {
                return Long.valueOf(token);
            } catch (NumberFormatException exception) {
                return null; // too many digits
            }
        }

        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte ||
            value instanceof AtomicInteger || value instanceof AtomicLong) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger bigInteger) {
            return bigInteger.bitLength() < Long.SIZE ? bigInteger.longValue() : null;
        }
        if (value instanceof BigDecimal bigDecimal) {
            return toLong(bigDecimal.toBigInteger()); // toBigInteger() truncates toward zero
        }
        if (value instanceof Number number) {
            double doubleValue = number.doubleValue();
            if (Double.isNaN(doubleValue) || LONG_RANGE <= Math.abs(doubleValue)) {
                return null;
            }
            return (long) doubleValue; // a narrowing cast truncates toward zero
        }

        // Booleans and everything else
        return null;
    }

    /**
     * Converts a raw value to an {@code int} using the same rules as {@link #toLong(Object)}.
     *
     * @param value
     *     The raw value.
     *
     * @return The converted value or {@code null} if {@code value} isn't an integer that fits in an {@code int}.
     */
    static Integer toInteger(Object value) {
        Long longValue = toLong(value);
        if (longValue == null || longValue < Integer.MIN_VALUE || Integer.MAX_VALUE < longValue) {
            return null;
        }
        return longValue.intValue();
    }

    /**
     * Converts a raw value to a finite {@code double}.
     * <p>
     * Strings must hold a decimal literal, like "15", "-0.5", ".5", or "1e3", optionally surrounded by whitespace.
     * Java's type suffixes, hexadecimal literals, "NaN" and "Infinity" are not accepted.
     * </p>
     *
     * @param value
     *     The raw value.
     *
     * @return The converted value or {@code null} if {@code value} isn't a finite number.
     */
    static Double toDouble(Object value) {
        final double doubleValue;
        if (value instanceof CharSequence charSequence) {
            String token = charSequence.toString().strip();
            if (!DECIMAL_TOKEN.matcher(token).matches()) {
                return null;
            }
            doubleValue = Double.parseDouble(token);
        } else if (value instanceof Number number) {
            doubleValue = number.doubleValue();
        } else {
            return null;
        }

        if (!Double.isFinite(doubleValue)) {
            return null;
        }
        return doubleValue + 0.0; // -0.0 becomes 0.0 so that it isn't ordered below a zero bound
    }
}
