///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

import java.util.NoSuchElementException;

/**
 * Thrown when a {@link Survey} is asked for a field that it doesn't have.
 */
public class FieldNotFoundException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message
     *     The detail message.
     */
    public FieldNotFoundException(String message) {
        super(message);
    }
}
