///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

/**
 * Thrown when a category code cannot be interpreted as an integer, or when two codes denote the same integer.
 */
public class CategoryCodeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message
     *     The detail message.
     */
    public CategoryCodeException(String message) {
        super(message);
    }
}
