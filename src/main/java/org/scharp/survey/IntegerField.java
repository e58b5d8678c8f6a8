///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

/**
 * A field whose answers are whole numbers.
 * <p>
 * A string answer must be an integer, like "42" or " -7 ", so "15.5" is rejected.  A numeric answer with a fractional
 * part is truncated toward zero, so {@code 15.5} is accepted as {@code 15}.
 * </p>
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class IntegerField extends NumericField<Long> {

    /**
     * A builder class for {@link IntegerField}.
     */
    public static final class Builder extends NumericField.Builder<Long, IntegerField, Builder> {

        private Builder() {
            super(ValueUtil::toLong);
        }

        @Override
        Builder self() {
            return this;
        }

        /**
         * Builds an {@code IntegerField} with the configured options.
         *
         * @return a new {@code IntegerField}
         *
         * @throws IllegalStateException
         *     if the name hasn't been set or if the minimum is greater than the maximum.
         */
        @Override
        public IntegerField build() {
            checkRequiredProperties();
            return new IntegerField(this);
        }
    }

    /**
     * Creates a new builder for an integer field with a blank title and no bounds.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private IntegerField(Builder builder) {
        super(builder);
    }

    @Override
    public FieldType type() {
        return FieldType.INTEGER;
    }
}
