package com.metagov.schema;

/**
 * One schema mismatch: JSON path of the offending value (e.g. {@code $.options[1]}) and what was expected.
 */
public record SchemaViolation(String path, String message) {

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
