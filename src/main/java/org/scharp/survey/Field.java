///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

/**
 * A variable of a survey dataset, such as a question on a questionnaire.
 * <p>
 * A field has a name, which identifies it within a {@link Survey}, and a descriptive title.  Each type of field knows
 * how to convert a raw answer (typically a string read from some external source, or a number) into the field's
 * canonical representation, rejecting answers that don't fit the field.  It also knows how to render an answer for
 * display.
 * </p>
 * <p>
 * Fields are created with a builder from the concrete subclass, for example:
 * </p>
 * <pre>
 * IntegerField ageField = IntegerField.builder().
 *     name("AGE").
 *     title("Age at enrollment").
 *     minimum(18).
 *     build();
 * </pre>
 *
 * <p>
 * Fields compare by identity.
 * </p>
 *
 * @param <T>
 *     The type of this field's canonical values.
 */
public abstract class Field<T> {

    private final String name;
    private final String title;

    /**
     * The properties shared by all field builders.
     *
     * @param <F>
     *     The type of field being built.
     * @param <B>
     *     The concrete type of the builder.
     */
    public abstract static class Builder<F extends Field<?>, B extends Builder<F, B>> {
        private String name;
        private String title;

        Builder() {
            this.name = null; // required parameter
            this.title = ""; // optional, so default to blank
        }

        abstract B self();

        /**
         * Sets the field's name.  Surrounding whitespace is removed.
         *
         * @param name
         *     The field's new name.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code name} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code name} is blank.
         */
        public B name(String name) {
            ArgumentUtil.checkNotNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("field names cannot be blank");
            }

            this.name = name.trim();
            return self();
        }

        /**
         * Sets the field's title.  Surrounding whitespace is removed.
         *
         * @param title
         *     The field's new title.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code title} is {@code null}.
         */
        public B title(String title) {
            ArgumentUtil.checkNotNull(title, "title");

            this.title = title.trim();
            return self();
        }

        /**
         * Throws an exception if a property that has no default hasn't been set.
         *
         * @throws IllegalStateException
         *     if the name hasn't been set.
         */
        void checkRequiredProperties() {
            if (name == null) {
                throw new IllegalStateException("name must be set");
            }
        }

        /**
         * Builds a field with the configured properties.
         *
         * @return A new field.
         *
         * @throws IllegalStateException
         *     if a required property hasn't been set or if the properties are inconsistent with each other.
         */
        public abstract F build();
    }

    Field(Builder<?, ?> builder) {
        this.name = builder.name;
        this.title = builder.title;
    }

    /**
     * Gets this field's name.
     *
     * @return This field's name, without surrounding whitespace.  This is never {@code null} or blank.
     */
    public String name() {
        return name;
    }

    /**
     * Gets this field's title.
     *
     * @return This field's title, without surrounding whitespace.  This may be the empty string but never
     *     {@code null}.
     */
    public String title() {
        return title;
    }

    /**
     * Gets this field's type.
     *
     * @return This field's type. This is never {@code null}.
     */
    public abstract FieldType type();

    /**
     * Converts a raw value into this field's canonical type and validates it against this field's constraints.
     * <p>
     * Converting a value that is already canonical gives back an equal value.
     * </p>
     *
     * @param value
     *     The raw value. This may be {@code null}.
     *
     * @return The canonical value, or {@code null} if {@code value} is absent.
     *
     * @throws ValidationException
     *     if {@code value} can't be converted or doesn't satisfy this field's constraints.
     */
    public abstract T coerce(Object value);

    /**
     * Renders a value in the form in which it should be shown to people.
     * <p>
     * By default, this returns {@code value} unchanged.  Categorical fields map codes to their labels.
     * </p>
     *
     * @param value
     *     The value to render.
     *
     * @return The value to display.
     */
    public Object displayValue(Object value) {
        return value;
    }

    /**
     * Gets a description of this field that includes its type, like "Q1. Age of type integer".
     *
     * @return A description of this field.
     */
    public String describe() {
        return this + " of type " + type().printName();
    }

    /**
     * Gets a string made of this field's name and title, like "Q1. Age".
     *
     * @return A string representation of this field.
     */
    @Override
    public String toString() {
        return name + ". " + title;
    }
}
