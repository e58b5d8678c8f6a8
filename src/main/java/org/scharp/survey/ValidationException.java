///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

/**
 * Thrown when a raw value cannot be converted to a field's type or when the converted value violates one of the
 * field's constraints (a bound or a set of category codes).
 */
public class ValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final transient Field<?> field;
    private final transient Object rawValue;

    /**
     * Creates a new validation exception.
     *
     * @param field
     *     The field that rejected the value.
     * @param rawValue
     *     The value that was rejected.  This may be {@code null}.
     * @param message
     *     A description of why the value was rejected.
     */
    public ValidationException(Field<?> field, Object rawValue, String message) {
        super(message);
        this.field = field;
        this.rawValue = rawValue;
    }

    /**
     * Gets the field that rejected the value.
     *
     * @return The field.  This is {@code null} if the exception has been deserialized.
     */
    public Field<?> field() {
        return field;
    }

    /**
     * Gets the value that was rejected, as it was given to the field.
     *
     * @return The rejected value.
     */
    public Object rawValue() {
        return rawValue;
    }
}
