package com.wingz.api.shared.exception;

public class ForbiddenException extends ApiException {

    public ForbiddenException() {
        super("You do not have permission to perform this action.");
    }
}
