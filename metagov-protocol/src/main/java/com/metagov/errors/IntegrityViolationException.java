package com.metagov.errors;

/**
 * A write would break a structural invariant (e.g. a link-group without exactly one primary id).
 * The write is rejected and the entities keep their prior state.
 */
public final class IntegrityViolationException extends MetagovException {

    public IntegrityViolationException(String message) {
        super(message);
    }
}
