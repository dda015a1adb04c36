package com.formpilot.domain.form.surface;

/**
 * The form surface could not be reached. Fatal to the whole session.
 */
public class FormSurfaceException extends RuntimeException {

    public FormSurfaceException(String message) {
        super(message);
    }

    public FormSurfaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
