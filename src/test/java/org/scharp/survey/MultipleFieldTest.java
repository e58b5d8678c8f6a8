///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link MultipleField}. */
public class MultipleFieldTest {

    private static MultipleField numberedField() {
        return MultipleField.builder().
            name("q1").
            title("This is test variable.").
            categories(CategoriesTest.numberedCategories(10)).
            build();
    }

    @Test
    void testDescription() {
        MultipleField field = numberedField();

        assertEquals(FieldType.MULTIPLE, field.type());
        assertEquals("q1. This is test variable. of type multiple", field.describe());
        assertEquals(CategoriesTest.numberedCategories(10), field.categories().asMap());
        assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10), field.codes());
    }

    @Test
    void testCoerce() {
        MultipleField field = numberedField();

        assertEquals(List.of(1, 4, 5, 6), field.coerce(Arrays.asList(1, "4", "5", "", 6.0)));
        assertEquals(List.of(1, 4), field.coerce(new Object[] { 1, null, "4" }));
        assertEquals(List.of(3, 2), field.coerce(new int[] { 3, 2 }));
        assertEquals(List.of(5, 6), field.coerce(new String[] { "5", "", "6" }));
        assertEquals(List.of(2, 3), field.coerce(new LinkedHashSet<>(List.of(2, 3))));

        // Order follows the input and duplicates are kept.
        assertEquals(List.of(9, 1, 9), field.coerce(List.of("9", "1", "9")));

        // A single value is a list of one.
        assertEquals(List.of(7), field.coerce("7"));
        assertEquals(List.of(7), field.coerce(7));
    }

    @Test
    void coerceAbsent() {
        MultipleField field = numberedField();

        assertNull(field.coerce(List.of("")));
        assertNull(field.coerce(List.of("", "")));
        assertNull(field.coerce(List.of()));
        assertNull(field.coerce(new String[0]));
        assertNull(field.coerce(""));
        assertNull(field.coerce(null));
    }

    @Test
    void coerceInvalidElement() {
        MultipleField field = numberedField();

        Exception exception = assertThrows(ValidationException.class, () -> field.coerce(List.of(1, 23, 5)));
        assertEquals(
            "Provided value 23 is not one of the category codes of field q1. This is test variable. of type multiple",
            exception.getMessage());

        exception = assertThrows(ValidationException.class, () -> field.coerce(List.of("1", "one")));
        assertEquals("Invalid input one for field q1. This is test variable. of type multiple", exception.getMessage());

        // Whitespace isn't blank.
        assertThrows(ValidationException.class, () -> field.coerce(List.of(" ")));

        // A nested list isn't a code.
        assertThrows(ValidationException.class, () -> field.coerce(List.of(List.of(1))));

        // Only Object[] and int[] arrays hold several codes; any other array is one value that isn't a code.
        assertThrows(ValidationException.class, () -> field.coerce(new long[] { 1L, 2L }));
    }

    @Test
    void coerceScenario() {
        MultipleField field = MultipleField.builder().name("q4").categories(Map.of(1, "A", 2, "B", 3, "C")).build();

        assertEquals(List.of(1, 2, 3), field.coerce(Arrays.asList(1, "2", "", 3)));
        assertThrows(ValidationException.class, () -> field.coerce(List.of(1, 9)));
    }

    @Test
    void coerceIsIdempotent() {
        MultipleField field = numberedField();
        List<Integer> codes = field.coerce(List.of("3", "", 1));
        assertEquals(codes, field.coerce(codes));
    }

    @Test
    void coercedListIsUnmodifiable() {
        MultipleField field = numberedField();
        List<Integer> codes = field.coerce(List.of("3"));
        assertThrows(UnsupportedOperationException.class, () -> codes.add(4));
    }

    @Test
    void testDisplayValue() {
        MultipleField field = MultipleField.builder().name("q4").categories(Map.of(1, "A", 2, "B", 3, "C")).build();

        assertEquals(List.of("C", "A"), field.displayValue(List.of("3", 1)));
        assertEquals(List.of("B"), field.displayValue("2"));
        assertNull(field.displayValue(List.of("")));
        assertThrows(ValidationException.class, () -> field.displayValue(List.of(4)));
    }

    @Test
    void replaceCategories() {
        MultipleField field = numberedField();

        field.replaceCategories(Map.of(11, "Eleven"));
        assertEquals(List.of(11), field.codes());
        assertEquals(List.of(11), field.coerce(List.of("11")));
        assertThrows(ValidationException.class, () -> field.coerce(List.of(1)));
    }
}
