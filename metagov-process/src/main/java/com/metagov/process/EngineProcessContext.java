package com.metagov.process;

import com.metagov.plugin.PluginContext;
import com.metagov.plugin.ProcessContext;
import com.metagov.plugin.ProcessStatus;
import com.metagov.state.KeyValueStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/** {@link ProcessContext} over a working copy of a process row. */
final class EngineProcessContext implements ProcessContext {

    private static final Logger log = LoggerFactory.getLogger(EngineProcessContext.class);

    private final GovernanceProcess working;
    private final ProcessRepository repository;
    private final KeyValueStateStore state;
    private final PluginContext plugin;

    EngineProcessContext(GovernanceProcess working, ProcessRepository repository, KeyValueStateStore state,
                         PluginContext plugin) {
        this.working = working;
        this.repository = repository;
        this.state = state;
        this.plugin = plugin;
    }

    GovernanceProcess snapshot() {
        return working.copy();
    }

    @Override
    public long getProcessId() {
        return working.getId();
    }

    @Override
    public String getProcessName() {
        return working.getName();
    }

    @Override
    public PluginContext getPlugin() {
        return plugin;
    }

    @Override
    public KeyValueStateStore getState() {
        return state;
    }

    @Override
    public ProcessStatus getStatus() {
        return working.getStatus();
    }

    @Override
    public void setStatus(ProcessStatus status) {
        working.setStatus(status);
    }

    @Override
    public String getUrl() {
        return working.getUrl();
    }

    @Override
    public void setUrl(String url) {
        working.setUrl(url);
    }

    @Override
    public String getCallbackUrl() {
        return working.getCallbackUrl();
    }

    @Override
    public Map<String, Object> getOutcome() {
        return working.getOutcome();
    }

    @Override
    public void setOutcome(Map<String, Object> outcome) {
        working.setOutcome(outcome);
    }

    @Override
    public Map<String, Object> getErrors() {
        return working.getErrors();
    }

    @Override
    public void setErrors(Map<String, Object> errors) {
        working.setErrors(errors);
    }

    @Override
    public void save() {
        if (!repository.update(working)) {
            log.debug("Process {} no longer exists; save ignored", working.getId());
        }
    }
}
