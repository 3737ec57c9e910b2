package com.metagov.errors;

/** Thrown for an unknown process type, or a process id that is absent or belongs to another type. */
public final class ProcessNotFoundException extends NotFoundException {

    public ProcessNotFoundException(String message) {
        super(message);
    }
}
