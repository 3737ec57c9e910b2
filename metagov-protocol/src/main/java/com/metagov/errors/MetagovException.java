package com.metagov.errors;

/**
 * Root of the core error taxonomy. Every error surfaced by the registry, the process engine
 * or the identity engine extends this type so the boundary layer can map it to a response
 * without depending on concrete subtypes.
 */
public class MetagovException extends RuntimeException {

    public MetagovException(String message) {
        super(message);
    }

    public MetagovException(String message, Throwable cause) {
        super(message, cause);
    }
}
