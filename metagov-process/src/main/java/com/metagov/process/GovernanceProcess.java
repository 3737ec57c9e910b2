package com.metagov.process;

import com.metagov.community.Community;
import com.metagov.plugin.ProcessStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One run of a long-lived external decision process. Instances handed out by the engine are
 * snapshots; the repository keeps its own copy.
 */
public final class GovernanceProcess {

    private final long id;
    private final String name;
    private final long pluginInstanceId;
    private final String pluginName;
    private final Community community;
    private final String callbackUrl;
    private final long stateId;
    private String url;
    private ProcessStatus status;
    private Map<String, Object> errors;
    private Map<String, Object> outcome;

    GovernanceProcess(long id, String name, long pluginInstanceId, String pluginName, Community community,
                      String callbackUrl, long stateId) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.pluginInstanceId = pluginInstanceId;
        this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        this.community = Objects.requireNonNull(community, "community");
        this.callbackUrl = callbackUrl;
        this.stateId = stateId;
        this.status = ProcessStatus.CREATED;
        this.errors = Map.of();
        this.outcome = Map.of();
    }

    GovernanceProcess copy() {
        GovernanceProcess c = new GovernanceProcess(id, name, pluginInstanceId, pluginName, community, callbackUrl, stateId);
        c.url = url;
        c.status = status;
        c.errors = errors;
        c.outcome = outcome;
        return c;
    }

    public long getId() {
        return id;
    }

    /** Process type name. */
    public String getName() {
        return name;
    }

    public long getPluginInstanceId() {
        return pluginInstanceId;
    }

    public String getPluginName() {
        return pluginName;
    }

    public Community getCommunity() {
        return community;
    }

    public String getCallbackUrl() {
        return callbackUrl;
    }

    public long getStateId() {
        return stateId;
    }

    public String getUrl() {
        return url;
    }

    void setUrl(String url) {
        this.url = url;
    }

    public ProcessStatus getStatus() {
        return status;
    }

    void setStatus(ProcessStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    public Map<String, Object> getErrors() {
        return errors;
    }

    void setErrors(Map<String, Object> errors) {
        this.errors = freeze(errors);
    }

    public Map<String, Object> getOutcome() {
        return outcome;
    }

    void setOutcome(Map<String, Object> outcome) {
        this.outcome = freeze(outcome);
    }

    private static Map<String, Object> freeze(Map<String, Object> m) {
        return m != null ? Collections.unmodifiableMap(new LinkedHashMap<>(m)) : Map.of();
    }

    /** Public view sent to the driver. */
    public Map<String, Object> serialize() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", id);
        out.put("name", name);
        out.put("community", community.getSlug());
        out.put("plugin", pluginName);
        out.put("url", url);
        out.put("callback_url", callbackUrl);
        out.put("status", status.value());
        out.put("errors", errors);
        out.put("outcome", outcome);
        return out;
    }

    @Override
    public String toString() {
        return pluginName + "." + name + " #" + id + " (" + status.value() + ")";
    }
}
