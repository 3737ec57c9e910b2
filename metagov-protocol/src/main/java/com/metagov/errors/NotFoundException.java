package com.metagov.errors;

/** A plugin type, plugin instance, process, identity or account is absent. Maps to a 4xx response. */
public class NotFoundException extends MetagovException {

    public NotFoundException(String message) {
        super(message);
    }
}
