package com.metagov.errors;

/** The operation is not implemented by the target process type (e.g. close on a process without close logic). */
public final class NotSupportedException extends MetagovException {

    public NotSupportedException(String message) {
        super(message);
    }
}
