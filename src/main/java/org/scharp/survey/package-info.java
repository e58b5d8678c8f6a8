///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
/**
 * <p>
 * This library describes the variables of a survey dataset and validates answers against them.
 * </p>
 *
 * <p>
 * See the documentation for {@link org.scharp.survey.Survey} for sample code on building a survey.
 * </p>
 *
 * <h2>Fields</h2>
 *
 * <p>
 * Each question of a questionnaire is described by a {@link org.scharp.survey.Field}.  A field has a name, a title, and
 * a type.  Answers usually arrive as text, so every field can convert a raw answer into its canonical form:
 * </p>
 * <ul>
 * <li>{@link org.scharp.survey.IntegerField} and {@link org.scharp.survey.FloatField} hold numbers, optionally between
 * a minimum and a maximum.</li>
 * <li>{@link org.scharp.survey.StringField} holds free text.</li>
 * <li>{@link org.scharp.survey.SingleField} and {@link org.scharp.survey.MultipleField} hold codes of a fixed set of
 * {@link org.scharp.survey.Categories}, each of which has a label.  For example, a "smoking status" question might
 * code 1 as "Never Smoked", 2 as "Quit", and 3 as "Active Smoker".  The codes are what gets stored; the labels are what
 * gets shown.</li>
 * </ul>
 *
 * <p>
 * An answer that is blank (for example, an empty string) is absent, which is represented as {@code null}.  An absent
 * answer is not an error, even for a field with bounds.
 * </p>
 *
 * <h2>Error Handling Strategy</h2>
 * <p>
 * This library throws clear exceptions as soon as possible (fail-fast).  An answer that doesn't fit its field causes a
 * {@link org.scharp.survey.ValidationException}, which names the field and the rejected value.  Mistakes in building
 * fields or surveys cause an {@link java.lang.IllegalArgumentException} (or a subclass of it, like
 * {@link org.scharp.survey.DuplicateFieldNameException}), a {@link java.lang.NullPointerException}, or an
 * {@link java.lang.IllegalStateException}.  A method that throws an exception leaves its object unchanged.
 * </p>
 */
package org.scharp.survey;
