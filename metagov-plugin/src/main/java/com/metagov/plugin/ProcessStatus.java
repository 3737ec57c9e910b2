package com.metagov.plugin;

/** Lifecycle status of a governance process. {@link #COMPLETED} is terminal. */
public enum ProcessStatus {
    CREATED("created"),
    PENDING("pending"),
    COMPLETED("completed");

    private final String value;

    ProcessStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED;
    }

    public static ProcessStatus fromValue(String value) {
        for (ProcessStatus s : values()) {
            if (s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown process status: " + value);
    }
}
