package com.formpilot.domain.form.model;

/**
 * One extracted form question.
 *
 * @param text          cleaned label text, the canonical key for every lookup
 * @param fields        the inputs found inside the question container
 * @param sourcePageUrl URL of the page the question was read from
 */
public record Question(
        String text,
        FieldSet fields,
        String sourcePageUrl
) {}
