///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

/**
 * A categorical field whose answer is a single category code, such as a multiple-choice question that allows one
 * choice.
 * <pre>
 * SingleField smokerField = SingleField.builder().
 *     name("SMOKER").
 *     title("Smoking status").
 *     categories(Map.of(1, "Never Smoked", 2, "Quit", 3, "Active Smoker")).
 *     build();
 *
 * smokerField.coerce("2");       // 2
 * smokerField.displayValue("2"); // "Quit"
 * </pre>
 */
public final class SingleField extends CategoricalField<Integer> {

    /**
     * A builder class for {@link SingleField}.
     */
    public static final class Builder extends CategoricalField.Builder<SingleField, Builder> {

        private Builder() {
        }

        @Override
        Builder self() {
            return this;
        }

        /**
         * Builds a {@code SingleField} with the configured options.
         *
         * @return a new {@code SingleField}
         *
         * @throws IllegalStateException
         *     if the name or categories haven't been set.
         */
        @Override
        public SingleField build() {
            checkRequiredProperties();
            return new SingleField(this);
        }
    }

    /**
     * Creates a new builder for a single-choice field with a blank title.
     * <p>
     * You must set the name and the categories before invoking {@link Builder#build() build()}.
     * </p>
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private SingleField(Builder builder) {
        super(builder);
    }

    @Override
    public FieldType type() {
        return FieldType.SINGLE;
    }

    /**
     * Converts a raw value to one of this field's category codes.  The raw value is converted with the same rules as
     * {@link IntegerField} uses.
     *
     * @param value
     *     The raw value.
     *
     * @return The category code, or {@code null} if {@code value} is absent.
     *
     * @throws ValidationException
     *     if {@code value} isn't an integer or isn't one of this field's codes.
     */
    @Override
    public Integer coerce(Object value) {
        return coerceCode(value);
    }

    /**
     * Gets the label of the category that a raw value selects.
     *
     * @param value
     *     The raw value.
     *
     * @return The category's label, or {@code null} if {@code value} is absent.
     *
     * @throws ValidationException
     *     if {@code value} isn't one of this field's codes.
     */
    @Override
    public String displayValue(Object value) {
        Integer code = coerce(value);
        if (code == null) {
            return null;
        }
        return labelOf(code);
    }
}
