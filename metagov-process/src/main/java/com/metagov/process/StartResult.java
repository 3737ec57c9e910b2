package com.metagov.process;

import java.util.Objects;

/**
 * Outcome of starting a process: either the committed process, or the failure with nothing committed.
 */
public final class StartResult {

    private final GovernanceProcess process;
    private final RuntimeException failure;

    private StartResult(GovernanceProcess process, RuntimeException failure) {
        this.process = process;
        this.failure = failure;
    }

    static StartResult started(GovernanceProcess process) {
        return new StartResult(Objects.requireNonNull(process, "process"), null);
    }

    static StartResult failed(RuntimeException failure) {
        return new StartResult(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isStarted() {
        return process != null;
    }

    /** The persisted process; null when the start failed. */
    public GovernanceProcess getProcess() {
        return process;
    }

    /** Why the start failed; null when it succeeded. */
    public RuntimeException getFailure() {
        return failure;
    }

    /** Returns the process or throws the failure. */
    public GovernanceProcess orThrow() {
        if (failure != null) {
            throw failure;
        }
        return process;
    }

    @Override
    public String toString() {
        return isStarted() ? "StartResult{started " + process + "}" : "StartResult{failed " + failure.getMessage() + "}";
    }
}
