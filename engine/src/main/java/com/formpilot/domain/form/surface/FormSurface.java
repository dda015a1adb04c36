package com.formpilot.domain.form.surface;

import com.formpilot.domain.form.model.FieldSet;

import java.util.List;

/**
 * The live, user-editable page the pipeline reads from and writes into.
 * <p>
 * Per-element operations may fail for a single element (stale or hidden inputs); callers treat
 * those failures as local. {@link FormSurfaceException} signals that the page state cannot be
 * read at all.
 * </p>
 */
public interface FormSurface {

    /**
     * Question containers on the current page, in document order. Empty if none were found.
     */
    List<ContainerHandle> listQuestionContainers();

    /**
     * Raw label of a container (heading, then title element, then first line of text).
     */
    String extractLabel(ContainerHandle container);

    FieldSet extractFields(ContainerHandle container);

    /**
     * Current value of a text, textarea or select field. Empty string when unset.
     */
    String readFieldValue(FieldHandle field);

    /**
     * Clears a text or textarea field and writes the value.
     *
     * @return true if the value was written
     */
    boolean setFieldValue(FieldHandle field, String value);

    /**
     * Visible label of a radio or checkbox option.
     */
    String optionLabel(FieldHandle field);

    boolean isSelected(FieldHandle field);

    /**
     * Visible option texts of a select element.
     */
    List<String> listOptions(FieldHandle select);

    /**
     * Activates an option: clicks a radio/checkbox handle, or chooses the option with the given
     * text on a select handle.
     *
     * @return true if the option was activated
     */
    boolean clickOption(FieldHandle field, String label);

    /**
     * @throws FormSurfaceException if the page cannot be reached at all
     */
    String currentPageUrl();
}
