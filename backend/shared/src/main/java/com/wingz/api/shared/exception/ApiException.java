package com.wingz.api.shared.exception;

/**
 * Base type of every error surfaced to API callers.
 */
public abstract class ApiException extends RuntimeException {

    protected ApiException(String message) {
        super(message);
    }
}
