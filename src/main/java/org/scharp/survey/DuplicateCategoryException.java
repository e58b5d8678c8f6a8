///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

/**
 * Thrown when two category labels of a single field are equal when compared case-insensitively.
 */
public class DuplicateCategoryException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message
     *     The detail message.
     */
    public DuplicateCategoryException(String message) {
        super(message);
    }
}
