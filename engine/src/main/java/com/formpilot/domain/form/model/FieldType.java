package com.formpilot.domain.form.model;

import java.util.Locale;

/**
 * Input modality of a question. Declaration order is the resolution priority:
 * when a question exposes several modalities the first populated one is used.
 */
public enum FieldType {
    TEXT,
    TEXTAREA,
    RADIO,
    CHECKBOX,
    SELECT;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
