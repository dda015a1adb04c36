package com.formpilot.domain.form.model;

/**
 * A user edit observed by the change monitor after it stayed stable long enough.
 *
 * @param original  value the field held when monitoring started
 * @param newValue  the stable edited value
 * @param fieldType modality of the edited question
 */
public record ManualChange(String original, String newValue, FieldType fieldType) {}
