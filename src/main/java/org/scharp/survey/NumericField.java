///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

import java.util.function.Function;

/**
 * A field whose answers are numbers, optionally restricted to an inclusive range.
 * <p>
 * A raw value that can't be converted to a number is absent if it's blank (for example, {@code null} or the empty
 * string) and invalid otherwise.  A bound of zero is a bound like any other.
 * </p>
 *
 * @param <T>
 *     The type of this field's canonical values.
 */
public abstract class NumericField<T extends Number & Comparable<T>> extends Field<T> {

    private final Function<Object, T> converter;
    private final T minimum;
    private final T maximum;

    /**
     * The properties shared by builders of numeric fields.
     *
     * @param <T>
     *     The type of the field's canonical values.
     * @param <F>
     *     The type of field being built.
     * @param <B>
     *     The concrete type of the builder.
     */
    public abstract static class Builder<T extends Number & Comparable<T>, F extends NumericField<T>, B extends Builder<T, F, B>>
        extends Field.Builder<F, B> {

        private final Function<Object, T> converter;
        private T minimum;
        private T maximum;

        Builder(Function<Object, T> converter) {
            this.converter = converter;
            this.minimum = null; // optional, so default to unbounded
            this.maximum = null; // optional, so default to unbounded
        }

        private T convertBound(Object bound, String boundName) {
            ArgumentUtil.checkNotNull(bound, boundName);

            T convertedBound = converter.apply(bound);
            if (convertedBound == null) {
                throw new IllegalArgumentException(boundName + " must be numeric but was \"" + bound + "\"");
            }
            return convertedBound;
        }

        /**
         * Sets the smallest value that the field accepts.
         *
         * @param minimum
         *     The field's new minimum. This is converted to the field's type.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code minimum} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code minimum} can't be converted to the field's type.
         */
        public B minimum(Number minimum) {
            this.minimum = convertBound(minimum, "minimum");
            return self();
        }

        /**
         * Sets the smallest value that the field accepts from its textual representation, as it might appear in a
         * configuration file.
         *
         * @param minimum
         *     The field's new minimum. This is parsed with the same rules that the field uses for its answers.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code minimum} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code minimum} isn't numeric.
         */
        public B minimum(String minimum) {
            this.minimum = convertBound(minimum, "minimum");
            return self();
        }

        /**
         * Sets the largest value that the field accepts.
         *
         * @param maximum
         *     The field's new maximum. This is converted to the field's type.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code maximum} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code maximum} can't be converted to the field's type.
         */
        public B maximum(Number maximum) {
            this.maximum = convertBound(maximum, "maximum");
            return self();
        }

        /**
         * Sets the largest value that the field accepts from its textual representation.
         *
         * @param maximum
         *     The field's new maximum. This is parsed with the same rules that the field uses for its answers.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code maximum} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code maximum} isn't numeric.
         */
        public B maximum(String maximum) {
            this.maximum = convertBound(maximum, "maximum");
            return self();
        }

        @Override
        void checkRequiredProperties() {
            super.checkRequiredProperties();

            if (minimum != null && maximum != null && 0 < minimum.compareTo(maximum)) {
                throw new IllegalStateException(
                    "minimum (" + minimum + ") must not be greater than maximum (" + maximum + ")");
            }
        }
    }

    NumericField(Builder<T, ?, ?> builder) {
        super(builder);
        this.converter = builder.converter;
        this.minimum = builder.minimum;
        this.maximum = builder.maximum;
    }

    /**
     * Gets the smallest value that this field accepts.
     *
     * @return This field's minimum or {@code null} if it has no lower bound.
     */
    public T minimum() {
        return minimum;
    }

    /**
     * Gets the largest value that this field accepts.
     *
     * @return This field's maximum or {@code null} if it has no upper bound.
     */
    public T maximum() {
        return maximum;
    }

    @Override
    public T coerce(Object value) {
        T number = converter.apply(value);
        if (number == null) {
            if (ValueUtil.isBlank(value)) {
                return null;
            }
            throw new ValidationException(this, value, "Invalid input " + value + " for field " + describe());
        }

        if (minimum != null && number.compareTo(minimum) < 0) {
            throw new ValidationException(this, value,
                "Provided value " + number + " is less than the allowed minimum value " + minimum + " for field " +
                    describe());
        }
        if (maximum != null && 0 < number.compareTo(maximum)) {
            throw new ValidationException(this, value,
                "Provided value " + number + " is greater than the allowed maximum value " + maximum + " for field " +
                    describe());
        }
        return number;
    }
}
