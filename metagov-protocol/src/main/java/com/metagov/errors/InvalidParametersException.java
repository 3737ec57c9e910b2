package com.metagov.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Caller-supplied parameters (action input, process start parameters or plugin config) do not
 * match the declared schema. Carries one entry per violation, each prefixed with its JSON path.
 */
public final class InvalidParametersException extends MetagovException {

    private final List<String> violations;

    public InvalidParametersException(String subject, List<String> violations) {
        super("Invalid parameters for " + subject + ": " + String.join("; ", violations));
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public List<String> getViolations() {
        return violations;
    }
}
