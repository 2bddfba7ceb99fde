package com.wingz.api.shared.exception;

public class NotFoundException extends ApiException {

    public NotFoundException(String entity, Object id) {
        super(entity + " not found: " + id);
    }
}
