///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

/**
 * A field whose answers are free text.  Any answer is accepted.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class StringField extends Field<String> {

    /**
     * A builder class for {@link StringField}.
     */
    public static final class Builder extends Field.Builder<StringField, Builder> {

        private Builder() {
        }

        @Override
        Builder self() {
            return this;
        }

        /**
         * Builds a {@code StringField} with the configured options.
         *
         * @return a new {@code StringField}
         *
         * @throws IllegalStateException
         *     if the name hasn't been set.
         */
        @Override
        public StringField build() {
            checkRequiredProperties();
            return new StringField(this);
        }
    }

    /**
     * Creates a new builder for a string field with a blank title.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private StringField(Builder builder) {
        super(builder);
    }

    @Override
    public FieldType type() {
        return FieldType.STRING;
    }

    /**
     * Converts a raw value to a string.
     *
     * @param value
     *     The raw value.
     *
     * @return The empty string if {@code value} is blank, otherwise {@code String.valueOf(value)}.  This is never
     *     {@code null}.
     */
    @Override
    public String coerce(Object value) {
        if (ValueUtil.isBlank(value)) {
            return "";
        }
        return String.valueOf(value);
    }
}
