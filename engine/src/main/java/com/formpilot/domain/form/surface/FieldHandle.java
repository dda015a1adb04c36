package com.formpilot.domain.form.surface;

/**
 * Opaque reference to a single input element on the form surface.
 * Only the {@link FormSurface} that produced it knows how to interpret it.
 */
public interface FieldHandle {
}
