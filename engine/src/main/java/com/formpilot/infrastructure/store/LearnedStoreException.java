package com.formpilot.infrastructure.store;

/**
 * Reading or writing the profile document failed. A failed write leaves the existing file untouched.
 */
public class LearnedStoreException extends RuntimeException {

    public LearnedStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
