package org.scharp.survey;

import java.util.Locale;

/**
 * A class with utility methods for validating arguments.
 */
abstract class ArgumentUtil {
    /**
     * Throws an exception if {@code argument} is {@code null}.
     *
     * @param argument
     *     The argument to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     */
    static void checkNotNull(Object argument, String argumentName) {
        if (argument == null) {
            throw new NullPointerException(argumentName + " must not be null");
        }
    }

    /**
     * Gets the key under which a name is compared.  Names are compared case-insensitively after surrounding
     * whitespace is removed.
     *
     * @param name
     *     A field name or category label.
     *
     * @return The normalized form of {@code name}.
     */
    static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
