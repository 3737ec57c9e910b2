package com.metagov.plugin;

import com.metagov.state.KeyValueStateStore;

import java.util.Map;

/**
 * Mutable view of one governance process handed to {@link ProcessDefinition} hooks. Changes are
 * kept in memory until {@link #save()} persists them; the engine also saves after every hook returns.
 */
public interface ProcessContext {

    long getProcessId();

    /** Process type name (e.g. "vote"). */
    String getProcessName();

    /** Context of the plugin instance that owns the process. */
    PluginContext getPlugin();

    /** Private state store of this process. */
    KeyValueStateStore getState();

    ProcessStatus getStatus();

    void setStatus(ProcessStatus status);

    /** External reference url (e.g. the poll page); may be null. */
    String getUrl();

    void setUrl(String url);

    /** Driver url to notify on completion; may be null. */
    String getCallbackUrl();

    /** Current outcome; empty map when none. */
    Map<String, Object> getOutcome();

    void setOutcome(Map<String, Object> outcome);

    /** Current error payload; empty map when none. */
    Map<String, Object> getErrors();

    void setErrors(Map<String, Object> errors);

    /** Persists status, url, outcome and errors. */
    void save();
}
