///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.survey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The set of categories (valid choices) of a categorical field.  Each category has an integer code and a label.
 * <p>
 * Codes are unique.  Labels are unique when compared case-insensitively, so "Yes" and "YES" can't both be labels.
 * Labels are stored without surrounding whitespace.
 * </p>
 * <p>
 * Instances of this class are immutable.  This class supports {@code equals()} and {@code hashCode()}.
 * </p>
 */
public final class Categories {

    private final SortedMap<Integer, String> labelsByCode;
    private final List<Integer> codes;

    private Categories(SortedMap<Integer, String> labelsByCode) {
        this.labelsByCode = Collections.unmodifiableSortedMap(labelsByCode);
        this.codes = List.copyOf(labelsByCode.keySet());
    }

    /**
     * Creates a set of categories from a map of codes to labels.
     * <p>
     * The codes are converted to integers in the same way that an {@link IntegerField} converts its answers, so
     * {@code 1}, {@code 1L}, {@code "1"} and {@code " 1 "} are all the code 1.
     * </p>
     *
     * @param categories
     *     A map from category code to category label.  The map is copied.
     *
     * @return A new set of categories.
     *
     * @throws NullPointerException
     *     if {@code categories} is {@code null} or has a {@code null} label.
     * @throws CategoryCodeException
     *     if a code can't be converted to an {@code int} or if two codes convert to the same {@code int}.
     * @throws DuplicateCategoryException
     *     if two labels are equal when compared case-insensitively.
     */
    public static Categories of(Map<?, String> categories) {
        ArgumentUtil.checkNotNull(categories, "categories");

        SortedMap<Integer, String> labelsByCode = new TreeMap<>();
        Map<String, Integer> codesByLabel = new HashMap<>();
        for (Map.Entry<?, String> entry : categories.entrySet()) {
            Integer code = ValueUtil.toInteger(entry.getKey());
            if (code == null) {
                throw new CategoryCodeException("Invalid value for category code: " + entry.getKey());
            }
            if (labelsByCode.containsKey(code)) {
                throw new CategoryCodeException("Category code " + code + " is given more than once");
            }

            String label = entry.getValue();
            ArgumentUtil.checkNotNull(label, "category label");
            label = label.trim();

            Integer previousCode = codesByLabel.putIfAbsent(ArgumentUtil.normalize(label), code);
            if (previousCode != null) {
                throw new DuplicateCategoryException(
                    "Category label \"" + label + "\" of code " + code + " duplicates the label \"" +
                        labelsByCode.get(previousCode) + "\" of code " + previousCode);
            }

            labelsByCode.put(code, label);
        }

        return new Categories(labelsByCode);
    }

    /**
     * Gets the categories as a map.
     *
     * @return An unmodifiable map from code to label, ordered by code.
     */
    public SortedMap<Integer, String> asMap() {
        return labelsByCode;
    }

    /**
     * Gets the codes of all categories.
     *
     * @return An unmodifiable list of codes in ascending order.
     */
    public List<Integer> codes() {
        return codes;
    }

    /**
     * Gets the categories as a list of code/label pairs, suitable for printing.
     *
     * @return An unmodifiable list of entries in ascending order of code.
     */
    public List<Map.Entry<Integer, String>> entries() {
        List<Map.Entry<Integer, String>> entries = new ArrayList<>(labelsByCode.size());
        for (Map.Entry<Integer, String> entry : labelsByCode.entrySet()) {
            entries.add(Map.entry(entry.getKey(), entry.getValue()));
        }
        return Collections.unmodifiableList(entries);
    }

    /**
     * Determines whether a code belongs to one of these categories.
     *
     * @param code
     *     The code to look for.
     *
     * @return {@code true} if there is a category with {@code code}, {@code false} otherwise.
     */
    public boolean contains(int code) {
        return labelsByCode.containsKey(code);
    }

    /**
     * Gets the label of a category.
     *
     * @param code
     *     The category's code.
     *
     * @return The label of the category with {@code code}, or {@code null} if there is no such category.
     */
    public String label(int code) {
        return labelsByCode.get(code);
    }

    /**
     * @return The number of categories.
     */
    public int size() {
        return labelsByCode.size();
    }

    /**
     * Finds the categories of another category set that have the same labels as these categories.
     * <p>
     * Labels are compared case-insensitively.  If {@code otherCategories} has several codes with the same label, the
     * last one in its iteration order is matched.
     * </p>
     *
     * @param otherCategories
     *     A map of codes to labels.
     *
     * @return A list of matches, ordered by this set's codes.  This is never {@code null}.
     *
     * @throws NullPointerException
     *     if {@code otherCategories} is {@code null} or has a {@code null} code or label.
     */
    public List<CategoryMatch> intersectLabels(Map<Integer, String> otherCategories) {
        ArgumentUtil.checkNotNull(otherCategories, "otherCategories");

        Map<String, Integer> otherCodesByLabel = new HashMap<>();
        for (Map.Entry<Integer, String> entry : otherCategories.entrySet()) {
            ArgumentUtil.checkNotNull(entry.getKey(), "category code");
            ArgumentUtil.checkNotNull(entry.getValue(), "category label");
            otherCodesByLabel.put(ArgumentUtil.normalize(entry.getValue()), entry.getKey());
        }

        List<CategoryMatch> matches = new ArrayList<>();
        for (Map.Entry<Integer, String> entry : labelsByCode.entrySet()) {
            Integer otherCode = otherCodesByLabel.get(ArgumentUtil.normalize(entry.getValue()));
            if (otherCode != null) {
                matches.add(new CategoryMatch(entry.getKey(), otherCode, entry.getValue()));
            }
        }
        return matches;
    }

    /**
     * Finds the categories of another category set that have the same labels as these categories.
     *
     * @param otherCategories
     *     The other categories.
     *
     * @return A list of matches, ordered by this set's codes.
     *
     * @throws NullPointerException
     *     if {@code otherCategories} is {@code null}.
     * @see #intersectLabels(Map)
     */
    public List<CategoryMatch> intersectLabels(Categories otherCategories) {
        ArgumentUtil.checkNotNull(otherCategories, "otherCategories");
        return intersectLabels(otherCategories.labelsByCode);
    }

    @Override
    public int hashCode() {
        return labelsByCode.hashCode();
    }

    /**
     * Determines if these categories are equal to another object.  Two category sets are equal if they have the same
     * codes with the same labels.
     *
     * @param other
     *     The object with which to compare.
     *
     * @return {@code true}, if these categories are equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Categories otherCategories)) {
            return false;
        }
        return labelsByCode.equals(otherCategories.labelsByCode);
    }

    @Override
    public String toString() {
        return labelsByCode.toString();
    }
}
