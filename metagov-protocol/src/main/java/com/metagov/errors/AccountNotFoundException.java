package com.metagov.errors;

/** Thrown when no MetagovId or LinkedAccount matches the lookup. */
public final class AccountNotFoundException extends NotFoundException {

    public AccountNotFoundException(String message) {
        super(message);
    }
}
