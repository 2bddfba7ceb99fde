package com.wingz.api.shared.exception;

public class UnauthenticatedException extends ApiException {

    public UnauthenticatedException() {
        super("Authentication credentials were not provided or are invalid.");
    }
}
