///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

/**
 * A field whose answers are finite floating-point numbers.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class FloatField extends NumericField<Double> {

    /**
     * A builder class for {@link FloatField}.
     */
    public static final class Builder extends NumericField.Builder<Double, FloatField, Builder> {

        private Builder() {
            super(ValueUtil::toDouble);
        }

        @Override
        Builder self() {
            return this;
        }

        /**
         * Builds a {@code FloatField} with the configured options.
         *
         * @return a new {@code FloatField}
         *
         * @throws IllegalStateException
         *     if the name hasn't been set or if the minimum is greater than the maximum.
         */
        @Override
        public FloatField build() {
            checkRequiredProperties();
            return new FloatField(this);
        }
    }

    /**
     * Creates a new builder for a float field with a blank title and no bounds.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private FloatField(Builder builder) {
        super(builder);
    }

    @Override
    public FieldType type() {
        return FieldType.FLOAT;
    }
}
