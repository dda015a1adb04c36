package com.formpilot.domain.form.surface;

/**
 * Opaque reference to a question container (label plus its inputs) on the form surface.
 */
public interface ContainerHandle {
}
