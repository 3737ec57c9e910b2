package com.metagov.errors;

/** No member of a link-group is primary. Indicates corrupted identity data. */
public final class NoPrimaryFoundException extends MetagovException {

    public NoPrimaryFoundException(String message) {
        super(message);
    }
}
