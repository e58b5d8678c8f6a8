///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A categorical field whose answer is a list of category codes, such as a "check all that apply" question.
 * <p>
 * A raw answer is an {@link Iterable}, an {@code Object[]} or an {@code int[]} of raw codes.  Blank codes are skipped, but if any other code is
 * invalid, the whole answer is rejected.  Codes are kept in the order in which they are given.
 * </p>
 */
public final class MultipleField extends CategoricalField<List<Integer>> {

    /**
     * A builder class for {@link MultipleField}.
     */
    public static final class Builder extends CategoricalField.Builder<MultipleField, Builder> {

        private Builder() {
        }

        @Override
        Builder self() {
            return this;
        }

        /**
         * Builds a {@code MultipleField} with the configured options.
         *
         * @return a new {@code MultipleField}
         *
         * @throws IllegalStateException
         *     if the name or categories haven't been set.
         */
        @Override
        public MultipleField build() {
            checkRequiredProperties();
            return new MultipleField(this);
        }
    }

    /**
     * Creates a new builder for a multiple-choice field with a blank title.
     * <p>
     * You must set the name and the categories before invoking {@link Builder#build() build()}.
     * </p>
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private MultipleField(Builder builder) {
        super(builder);
    }

    @Override
    public FieldType type() {
        return FieldType.MULTIPLE;
    }

    /**
     * Converts a raw answer to a list of this field's category codes.
     *
     * @param value
     *     An {@code Iterable}, an {@code Object[]} or an {@code int[]} of raw codes.  Any other non-null value is
     *     treated as a list with one element.
     *
     * @return An unmodifiable list of codes in the order given, or {@code null} if {@code value} is {@code null} or
     *     has no codes that aren't blank.
     *
     * @throws ValidationException
     *     if any element that isn't blank is not one of this field's codes.
     */
    @Override
    public List<Integer> coerce(Object value) {
        if (value == null) {
            return null;
        }

        List<Integer> codes = new ArrayList<>();
        if (value instanceof Iterable<?> iterable) {
            for (Object element : iterable) {
                addCode(codes, element);
            }
        } else if (value instanceof Object[] array) {
            for (Object element : array) {
                addCode(codes, element);
            }
        } else if (value instanceof int[] array) {
            for (int element : array) {
                addCode(codes, element);
            }
        } else {
            addCode(codes, value);
        }

        if (codes.isEmpty()) {
            return null;
        }
        return Collections.unmodifiableList(codes);
    }

    private void addCode(List<Integer> codes, Object element) {
        Integer code = coerceCode(element);
        if (code != null) {
            codes.add(code);
        }
    }

    /**
     * Gets the labels of the categories that a raw answer selects.
     *
     * @param value
     *     The raw answer.
     *
     * @return An unmodifiable list of labels in the order of the answer's codes, or {@code null} if the answer is
     *     absent.
     *
     * @throws ValidationException
     *     if any element that isn't blank is not one of this field's codes.
     */
    @Override
    public List<String> displayValue(Object value) {
        List<Integer> codes = coerce(value);
        if (codes == null) {
            return null;
        }

        List<String> labels = new ArrayList<>(codes.size());
        for (int code : codes) {
            labels.add(labelOf(code));
        }
        return Collections.unmodifiableList(labels);
    }
}
