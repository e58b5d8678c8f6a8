package org.scharp.survey;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ArgumentUtilTest {

    /** Tests for {@link ArgumentUtil#checkNotNull(Object, String)} */
    @Test
    void testCheckNotNull() {
        ArgumentUtil.checkNotNull("", "arg");
        ArgumentUtil.checkNotNull(0, "arg");

        Exception exception = assertThrows(NullPointerException.class, () -> ArgumentUtil.checkNotNull(null, "myArg"));
        assertEquals("myArg must not be null", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#normalize(String)} */
    @Test
    void testNormalize() {
        assertEquals("q1", ArgumentUtil.normalize("q1"));
        assertEquals("q1", ArgumentUtil.normalize("Q1"));
        assertEquals("q1", ArgumentUtil.normalize("  Q1\t"));
        assertEquals("category 1", ArgumentUtil.normalize(" Category 1 "));
        assertEquals("", ArgumentUtil.normalize("   "));
    }

    /** Tests that {@link ArgumentUtil#normalize(String)} lower-cases "I" to a dotted "i" in a Turkish locale. */
    @Test
    void testNormalizeInTurkishLocale() {
        Locale originalLocale = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr"));
            assertEquals("t\u0131tle", "TITLE".toLowerCase(), "TEST BUG: default locale doesn't have a dotless i");

            assertEquals("title", ArgumentUtil.normalize("TITLE"));
            assertEquals("q1", ArgumentUtil.normalize(" Q1 "));
        } finally {
            Locale.setDefault(originalLocale);
        }
    }
}
