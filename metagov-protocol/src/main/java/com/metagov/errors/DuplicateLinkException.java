package com.metagov.errors;

/** A LinkedAccount already claims the (community, platform type, identifier, community platform id) tuple. */
public final class DuplicateLinkException extends MetagovException {

    public DuplicateLinkException(String message) {
        super(message);
    }
}
