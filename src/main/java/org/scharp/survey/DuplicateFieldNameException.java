///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

/**
 * Thrown when a field cannot be added to a {@link Survey} because the survey already has a field with the same name.
 */
public class DuplicateFieldNameException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message
     *     The detail message.
     */
    public DuplicateFieldNameException(String message) {
        super(message);
    }
}
