///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * A field whose answers are codes of a fixed set of {@link Categories}.
 * <p>
 * The categories can be replaced after the field is built, but a categorical field always has categories.
 * </p>
 * <p>
 * This class is not thread-safe.  Callers that share a field across threads must serialize calls to
 * {@link #replaceCategories(Map)}.
 * </p>
 *
 * @param <T>
 *     The type of this field's canonical values.
 */
public abstract class CategoricalField<T> extends Field<T> {

    private static final Logger log = LoggerFactory.getLogger(CategoricalField.class);

    private Categories categories;

    /**
     * The properties shared by builders of categorical fields.
     *
     * @param <F>
     *     The type of field being built.
     * @param <B>
     *     The concrete type of the builder.
     */
    public abstract static class Builder<F extends CategoricalField<?>, B extends Builder<F, B>>
        extends Field.Builder<F, B> {

        private Categories categories;

        Builder() {
            this.categories = null; // required parameter
        }

        /**
         * Sets the field's categories.
         *
         * @param categories
         *     The field's new categories.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code categories} is {@code null}.
         */
        public B categories(Categories categories) {
            ArgumentUtil.checkNotNull(categories, "categories");

            this.categories = categories;
            return self();
        }

        /**
         * Sets the field's categories from a map of codes to labels.
         *
         * @param categories
         *     A map from category code to label.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code categories} is {@code null} or has a {@code null} label.
         * @throws CategoryCodeException
         *     if a code isn't an integer or two codes denote the same integer.
         * @throws DuplicateCategoryException
         *     if two labels are equal when compared case-insensitively.
         * @see Categories#of(Map)
         */
        public B categories(Map<?, String> categories) {
            return categories(Categories.of(categories));
        }

        @Override
        void checkRequiredProperties() {
            super.checkRequiredProperties();

            if (categories == null) {
                throw new IllegalStateException("categories must be set");
            }
        }
    }

    CategoricalField(Builder<?, ?> builder) {
        super(builder);
        this.categories = builder.categories;
    }

    /**
     * Gets this field's categories.
     *
     * @return This field's categories. This is never {@code null}.
     */
    public Categories categories() {
        return categories;
    }

    /**
     * Gets the codes of this field's categories.
     *
     * @return An unmodifiable list of codes in ascending order.
     */
    public List<Integer> codes() {
        return categories.codes();
    }

    /**
     * Replaces this field's categories.
     *
     * @param newCategories
     *     The field's new categories.
     *
     * @throws NullPointerException
     *     if {@code newCategories} is {@code null}.
     */
    public void replaceCategories(Categories newCategories) {
        ArgumentUtil.checkNotNull(newCategories, "newCategories");

        log.debug("Replacing {} categories of field {} with {}", categories.size(), name(), newCategories.size());
        categories = newCategories;
    }

    /**
     * Replaces this field's categories with categories built from a map of codes to labels.  If the map is not a
     * valid set of categories, this field keeps its current categories.
     *
     * @param newCategories
     *     A map from category code to label.
     *
     * @throws NullPointerException
     *     if {@code newCategories} is {@code null} or has a {@code null} label.
     * @throws CategoryCodeException
     *     if a code isn't an integer or two codes denote the same integer.
     * @throws DuplicateCategoryException
     *     if two labels are equal when compared case-insensitively.
     */
    public void replaceCategories(Map<?, String> newCategories) {
        replaceCategories(Categories.of(newCategories));
    }

    /**
     * Finds the categories in {@code otherCategories} that have the same labels as this field's categories.
     *
     * @param otherCategories
     *     A map of codes to labels, typically the categories of a similar field in another survey.
     *
     * @return A list of matches, ordered by this field's codes.
     *
     * @see Categories#intersectLabels(Map)
     */
    public List<CategoryMatch> intersectLabels(Map<Integer, String> otherCategories) {
        return categories.intersectLabels(otherCategories);
    }

    /**
     * Converts a single raw value to one of this field's category codes.
     *
     * @param value
     *     The raw value.
     *
     * @return The code or {@code null} if {@code value} is absent.
     *
     * @throws ValidationException
     *     if {@code value} isn't an integer or isn't one of this field's codes.
     */
    Integer coerceCode(Object value) {
        Long number = ValueUtil.toLong(value);
        if (number == null) {
            if (ValueUtil.isBlank(value)) {
                return null;
            }
            throw new ValidationException(this, value, "Invalid input " + value + " for field " + describe());
        }

        if (number < Integer.MIN_VALUE || Integer.MAX_VALUE < number || !categories.contains(number.intValue())) {
            throw new ValidationException(this, value,
                "Provided value " + number + " is not one of the category codes of field " + describe());
        }
        return number.intValue();
    }

    /**
     * Gets the label of a code that has been validated with {@link #coerceCode(Object)}.
     */
    String labelOf(int code) {
        return categories.label(code);
    }
}
