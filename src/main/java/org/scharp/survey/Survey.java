///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * The structure of a survey: an ordered collection of fields with unique names.
 * <p>
 * Field names are compared case-insensitively after surrounding whitespace is removed, so a survey can't have both a
 * "Q1" and a "q1" field, and {@code field(" q1 ")} finds the "Q1" field.
 * </p>
 * <p>
 * Surveys are created with a {@link Survey.Builder} and can be modified afterward:
 * </p>
 * <pre>
 * Survey survey = Survey.builder().
 *     name("SRV1").
 *     title("Patient intake").
 *     fields(
 *         List.of(
 *             IntegerField.builder().name("AGE").title("Age").minimum(0).build(),
 *             StringField.builder().name("CITY").title("City of residence").build()
 *     )).build();
 *
 * survey.append(FloatField.builder().name("WEIGHT").title("Weight in kg").build());
 * Long age = survey.field("age", IntegerField.class).coerce("42");
 * </pre>
 * <p>
 * A failed modification leaves the survey unchanged.  This class is not thread-safe; callers that share a survey
 * across threads must serialize modifications.
 * </p>
 */
public final class Survey implements Iterable<Field<?>> {

    private static final Logger log = LoggerFactory.getLogger(Survey.class);

    private final String name;
    private final String title;
    private final List<Field<?>> fields;
    private final Map<String, Field<?>> fieldsByName;

    /**
     * A builder class for {@link Survey}.
     */
    public static final class Builder {
        private String name;
        private String title;
        private List<Field<?>> fields;

        private Builder() {
            this.name = ""; // optional, so default to blank
            this.title = ""; // optional, so default to blank
            this.fields = List.of();
        }

        /**
         * Sets the survey's name.  Surrounding whitespace is removed.
         *
         * @param name
         *     The survey's new name.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code name} is {@code null}.
         */
        public Builder name(String name) {
            ArgumentUtil.checkNotNull(name, "name");

            this.name = name.trim();
            return this;
        }

        /**
         * Sets the survey's title.  Surrounding whitespace is removed.
         *
         * @param title
         *     The survey's new title.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code title} is {@code null}.
         */
        public Builder title(String title) {
            ArgumentUtil.checkNotNull(title, "title");

            this.title = title.trim();
            return this;
        }

        /**
         * Sets the survey's initial fields.
         *
         * @param fields
         *     The fields, in the order in which they should appear in the survey.  This list is copied, so subsequent
         *     changes to the list do not impact this builder or the resulting survey.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code fields} is {@code null} or contains a {@code null} entry.
         */
        public Builder fields(List<? extends Field<?>> fields) {
            ArgumentUtil.checkNotNull(fields, "fields");

            // Copy the fields while checking for null entries.  Duplicate names are detected by build().
            List<Field<?>> newList = new ArrayList<>(fields.size());
            for (Field<?> field : fields) {
                if (field == null) {
                    throw new NullPointerException("fields cannot contain a null entry");
                }
                newList.add(field);
            }

            this.fields = newList;
            return this;
        }

        /**
         * Builds a survey with the configured options.
         *
         * @return a new {@code Survey}
         *
         * @throws DuplicateFieldNameException
         *     if two of the fields have the same name.
         */
        public Survey build() {
            Survey survey = new Survey(name, title);
            for (Field<?> field : fields) {
                survey.append(field);
            }
            return survey;
        }
    }

    /**
     * Creates a new survey builder with a blank name, a blank title, and no fields.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private Survey(String name, String title) {
        this.name = name;
        this.title = title;
        this.fields = new ArrayList<>();
        this.fieldsByName = new HashMap<>();
    }

    /**
     * Gets this survey's name.
     *
     * @return This survey's name. This may be the empty string but never {@code null}.
     */
    public String name() {
        return name;
    }

    /**
     * Gets this survey's title.
     *
     * @return This survey's title. This may be the empty string but never {@code null}.
     */
    public String title() {
        return title;
    }

    private String checkNameIsFree(Field<?> field) {
        ArgumentUtil.checkNotNull(field, "field");

        String key = ArgumentUtil.normalize(field.name());
        if (fieldsByName.containsKey(key)) {
            throw new DuplicateFieldNameException(
                "Error while adding field " + field + ": field with given name already exists in the survey");
        }
        return key;
    }

    private String keyOf(String fieldName) {
        ArgumentUtil.checkNotNull(fieldName, "fieldName");

        String key = ArgumentUtil.normalize(fieldName);
        if (!fieldsByName.containsKey(key)) {
            throw new FieldNotFoundException("Field with name " + fieldName + " doesn't exist in the survey");
        }
        return key;
    }

    /**
     * Adds a field to the end of this survey.
     *
     * @param field
     *     The field to add.
     *
     * @throws NullPointerException
     *     if {@code field} is {@code null}.
     * @throws DuplicateFieldNameException
     *     if this survey already has a field with the same name.
     */
    public void append(Field<?> field) {
        String key = checkNameIsFree(field);

        fields.add(field);
        fieldsByName.put(key, field);
        log.debug("Appended field {} to survey {}", field.name(), name);
    }

    /**
     * Adds a field to this survey at a given position.  The field at that position, and all fields after it, are moved
     * one position later.
     * <p>
     * A position past the end adds the field at the end.  A negative position counts back from the end, so -1 inserts
     * the field before the last field; a negative position before the start adds the field at the start.
     * </p>
     *
     * @param position
     *     The position of the new field.
     * @param field
     *     The field to add.
     *
     * @throws NullPointerException
     *     if {@code field} is {@code null}.
     * @throws DuplicateFieldNameException
     *     if this survey already has a field with the same name.
     */
    public void insert(int position, Field<?> field) {
        String key = checkNameIsFree(field);

        int index = position < 0 ? Math.max(0, fields.size() + position) : Math.min(position, fields.size());
        fields.add(index, field);
        fieldsByName.put(key, field);
        log.debug("Inserted field {} into survey {} at position {}", field.name(), name, index);
    }

    /**
     * Removes a field from this survey.
     *
     * @param fieldName
     *     The name of the field to remove.
     *
     * @return The removed field.
     *
     * @throws NullPointerException
     *     if {@code fieldName} is {@code null}.
     * @throws FieldNotFoundException
     *     if this survey has no field named {@code fieldName}.
     */
    public Field<?> remove(String fieldName) {
        String key = keyOf(fieldName);

        Field<?> field = fieldsByName.remove(key);
        fields.remove(field);
        log.debug("Removed field {} from survey {}", field.name(), name);
        return field;
    }

    /**
     * Gets a field by its name.
     *
     * @param fieldName
     *     The field's name.  This is compared case-insensitively and surrounding whitespace is ignored.
     *
     * @return The field. This is never {@code null}.
     *
     * @throws NullPointerException
     *     if {@code fieldName} is {@code null}.
     * @throws FieldNotFoundException
     *     if this survey has no field named {@code fieldName}.
     */
    public Field<?> field(String fieldName) {
        return fieldsByName.get(keyOf(fieldName));
    }

    /**
     * Gets a field by its name, checking that it is of the expected class.
     *
     * @param fieldName
     *     The field's name.  This is compared case-insensitively and surrounding whitespace is ignored.
     * @param fieldClass
     *     The class that the field is expected to have, like {@code SingleField.class}.
     * @param <F>
     *     The type of the field.
     *
     * @return The field. This is never {@code null}.
     *
     * @throws NullPointerException
     *     if {@code fieldName} or {@code fieldClass} is {@code null}.
     * @throws FieldNotFoundException
     *     if this survey has no field named {@code fieldName}.
     * @throws ClassCastException
     *     if the field is not an instance of {@code fieldClass}.
     */
    public <F extends Field<?>> F field(String fieldName, Class<F> fieldClass) {
        ArgumentUtil.checkNotNull(fieldClass, "fieldClass");

        Field<?> field = field(fieldName);
        if (!fieldClass.isInstance(field)) {
            throw new ClassCastException(
                "field " + field.name() + " is of type " + field.type().printName() + ", not " +
                    fieldClass.getSimpleName());
        }
        return fieldClass.cast(field);
    }

    /**
     * Determines whether this survey has a field with a given name.
     *
     * @param fieldName
     *     The field's name.  This is compared case-insensitively and surrounding whitespace is ignored.
     *
     * @return {@code true} if this survey has such a field, {@code false} otherwise.
     *
     * @throws NullPointerException
     *     if {@code fieldName} is {@code null}.
     */
    public boolean contains(String fieldName) {
        ArgumentUtil.checkNotNull(fieldName, "fieldName");
        return fieldsByName.containsKey(ArgumentUtil.normalize(fieldName));
    }

    /**
     * Gets the field at a given position.
     *
     * @param position
     *     The field's position.
     *
     * @return The field. This is never {@code null}.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code position} is negative or not less than {@link #size()}.
     */
    public Field<?> get(int position) {
        return fields.get(position);
    }

    /**
     * @return The number of fields in this survey.
     */
    public int size() {
        return fields.size();
    }

    /**
     * Returns the fields of this survey.
     *
     * @return An unmodifiable view of this survey's fields, in order.
     */
    public List<Field<?>> fields() {
        return Collections.unmodifiableList(fields);
    }

    /**
     * Returns an iterator over this survey's fields in order.  The iterator doesn't support {@code remove()}.
     *
     * @return An iterator.
     */
    @Override
    public Iterator<Field<?>> iterator() {
        return fields().iterator();
    }

    @Override
    public int hashCode() {
        return fieldsByName.hashCode();
    }

    /**
     * Determines if this survey is equal to another object.
     * <p>
     * Two surveys are equal if they have the same field objects under the same names, regardless of the order of the
     * fields.  The names and titles of the surveys are not compared.
     * </p>
     *
     * @param other
     *     The object with which to compare this survey.
     *
     * @return {@code true}, if this survey is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Survey otherSurvey)) {
            return false;
        }
        return fieldsByName.equals(otherSurvey.fieldsByName);
    }

    @Override
    public String toString() {
        return name + ". " + title;
    }
}
