package com.metagov.plugin;

import com.metagov.errors.NotSupportedException;
import com.metagov.schema.JsonSchema;
import com.metagov.schema.Parameters;

import java.util.Map;

/**
 * Lifecycle hooks of one process type. {@link #start} is required; {@link #close} is optional and
 * rejects with {@link NotSupportedException} by default; webhooks and updates are ignored by default.
 * <p>
 * Hooks run while the engine holds the process lock, so they never race each other for one process.
 * A hook that moves the process to {@link ProcessStatus#COMPLETED} should also set its outcome.
 */
public interface ProcessDefinition {

    /** Process type name, unique within the plugin (e.g. "vote"). */
    String getName();

    default String getDescription() {
        return "";
    }

    /** Start parameters schema; declared defaults are filled before {@link #start}. null = any. */
    default JsonSchema getInputSchema() {
        return null;
    }

    /** Shape of the outcome, for listings. null = unspecified. */
    default JsonSchema getOutcomeSchema() {
        return null;
    }

    /**
     * Starts the process on the external platform. On success the process should be {@link ProcessStatus#PENDING}.
     * Any exception rolls the process back.
     */
    void start(ProcessContext process, Parameters parameters) throws Exception;

    default void close(ProcessContext process) throws Exception {
        throw new NotSupportedException("Process '" + getName() + "' does not support close");
    }

    /** Inspects an inbound webhook; payloads meant for other processes must be ignored. */
    default void receiveWebhook(ProcessContext process, Map<String, Object> payload) throws Exception {
    }

    /** Polls the platform or checks a closing condition. Called periodically while not completed. */
    default void update(ProcessContext process) throws Exception {
    }
}
