///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

import java.util.Objects;

/**
 * A pair of categories from two different category sets that have the same label.
 * <p>
 * Instances of this class are immutable.
 * </p>
 *
 * @see Categories#intersectLabels(java.util.Map)
 */
public final class CategoryMatch {
    private final int code;
    private final int otherCode;
    private final String label;

    CategoryMatch(int code, int otherCode, String label) {
        this.code = code;
        this.otherCode = otherCode;
        this.label = label;
    }

    /**
     * @return The category's code in the set on which {@code intersectLabels} was invoked.
     */
    public int code() {
        return code;
    }

    /**
     * @return The category's code in the other set.
     */
    public int otherCode() {
        return otherCode;
    }

    /**
     * @return The category's label, as it is given in the set on which {@code intersectLabels} was invoked.
     */
    public String label() {
        return label;
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, otherCode, label);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CategoryMatch otherMatch)) {
            return false;
        }

        return code == otherMatch.code &&
            otherCode == otherMatch.otherCode &&
            label.equals(otherMatch.label);
    }

    @Override
    public String toString() {
        return "(" + code + ", " + otherCode + ", " + label + ")";
    }
}
