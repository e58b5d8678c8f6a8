///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link SingleField}. */
public class SingleFieldTest {

    private static SingleField numberedField() {
        return SingleField.builder().
            name("q1").
            title("This is test variable.").
            categories(CategoriesTest.numberedCategories(10)).
            build();
    }

    @Test
    void testDescription() {
        SingleField field = numberedField();

        assertEquals(FieldType.SINGLE, field.type());
        assertEquals("q1. This is test variable.", field.toString());
        assertEquals("q1. This is test variable. of type single", field.describe());
        assertEquals(CategoriesTest.numberedCategories(10), field.categories().asMap());
        assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10), field.codes());
    }

    @Test
    void testCoerce() {
        SingleField field = numberedField();

        assertEquals(4, field.coerce("4"));
        assertEquals(4, field.coerce(4));
        assertEquals(4, field.coerce(4L));
        assertEquals(4, field.coerce(4.9)); // truncated like an IntegerField
        assertNull(field.coerce(""));
        assertNull(field.coerce(null));

        Exception exception = assertThrows(ValidationException.class, () -> field.coerce(11));
        assertEquals("Provided value 11 is not one of the category codes of field q1. This is test variable. of type single",
            exception.getMessage());

        exception = assertThrows(ValidationException.class, () -> field.coerce("four"));
        assertEquals("Invalid input four for field q1. This is test variable. of type single", exception.getMessage());

        assertThrows(ValidationException.class, () -> field.coerce("4.0"));
        assertThrows(ValidationException.class, () -> field.coerce(0));
        assertThrows(ValidationException.class, () -> field.coerce(Long.MAX_VALUE));
    }

    @Test
    void coerceIsIdempotent() {
        SingleField field = numberedField();
        Integer code = field.coerce(" 7 ");
        assertEquals(code, field.coerce(code));
    }

    @Test
    void testDisplayValue() {
        SingleField field = numberedField();

        assertEquals("Category 4", field.displayValue("4"));
        assertEquals("Category 10", field.displayValue(10));
        assertNull(field.displayValue(""));

        assertThrows(ValidationException.class, () -> field.displayValue("11"));
    }

    @Test
    void coerceScenario() {
        SingleField field = SingleField.builder().name("q1").categories(Map.of(1, "A", 2, "B")).build();

        assertEquals(2, field.coerce("2"));
        assertEquals("B", field.displayValue("2"));
        assertThrows(ValidationException.class, () -> field.coerce("3"));
    }

    @Test
    void replaceCategories() {
        SingleField field = numberedField();

        field.replaceCategories(Map.of("20", "Twenty", 30, "Thirty"));
        assertEquals(List.of(20, 30), field.codes());
        assertEquals(Map.of(20, "Twenty", 30, "Thirty"), field.categories().asMap());
        assertEquals(20, field.coerce("20"));
        assertEquals("Thirty", field.displayValue(30));
        assertThrows(ValidationException.class, () -> field.coerce("1"));

        Categories categories = Categories.of(Map.of(1, "Yes", 2, "No"));
        field.replaceCategories(categories);
        assertSame(categories, field.categories());
        assertEquals("No", field.displayValue("2"));
    }

    @Test
    void replaceCategoriesIsAtomic() {
        SingleField field = numberedField();
        Categories original = field.categories();

        assertThrows(CategoryCodeException.class, () -> field.replaceCategories(Map.of("x", "Ex")));
        assertThrows(DuplicateCategoryException.class, () -> field.replaceCategories(Map.of(1, "a", 2, "A")));
        Exception exception = assertThrows(NullPointerException.class,
            () -> field.replaceCategories((Categories) null));
        assertEquals("newCategories must not be null", exception.getMessage());

        // The failed replacements shouldn't have changed anything.
        assertSame(original, field.categories());
        assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10), field.codes());
        assertEquals(5, field.coerce("5"));
    }

    @Test
    void testIntersectLabels() {
        SingleField field = numberedField();
        Map<Integer, String> other = Map.of(100, "category 3", 200, "Category 7", 300, "Other");

        assertEquals(List.of(new CategoryMatch(3, 100, "Category 3"), new CategoryMatch(7, 200, "Category 7")),
            field.intersectLabels(other));
    }

    @Test
    void setBadCategories() {
        SingleField.Builder builder = SingleField.builder().name("q1").categories(Map.of(1, "Yes"));

        Exception exception = assertThrows(CategoryCodeException.class,
            () -> builder.categories(Map.of(1.5f, "ok", "bad", "Bad")));
        assertEquals("Invalid value for category code: bad", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> builder.categories((Categories) null));
        assertEquals("categories must not be null", exception.getMessage());

        // The exceptions shouldn't corrupt the state of the builder.
        assertEquals(Map.of(1, "Yes"), builder.build().categories().asMap());
    }

    @Test
    void buildWithoutCategories() {
        SingleField.Builder builder = SingleField.builder().name("q1");

        Exception exception = assertThrows(IllegalStateException.class, builder::build);
        assertEquals("categories must be set", exception.getMessage());
    }
}
