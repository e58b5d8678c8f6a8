///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

import java.util.Locale;

/**
 * The type of survey field.
 */
public enum FieldType {
    /** A whole-number field */
    INTEGER,

    /** A floating-point field */
    FLOAT,

    /** A free-text field */
    STRING,

    /** A categorical field that accepts one category code */
    SINGLE,

    /** A categorical field that accepts any number of category codes */
    MULTIPLE;

    /**
     * Gets the name of this type as it is shown to people, for example "integer" or "single".
     *
     * @return The lower-case name of this type.
     */
    public String printName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
