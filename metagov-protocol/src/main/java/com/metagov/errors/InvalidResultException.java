package com.metagov.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An action handler returned a result that does not match its output schema.
 * Signals a bug in the integration, not a caller error.
 */
public final class InvalidResultException extends MetagovException {

    private final List<String> violations;

    public InvalidResultException(String subject, List<String> violations) {
        super("Invalid result from " + subject + ": " + String.join("; ", violations));
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public List<String> getViolations() {
        return violations;
    }
}
