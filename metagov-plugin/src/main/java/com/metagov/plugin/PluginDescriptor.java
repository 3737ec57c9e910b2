package com.metagov.plugin;

import com.metagov.schema.JsonSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Capability descriptor of a plugin type: auth mode, config schema, actions and process types.
 * Built once by a {@link PluginProvider} and immutable afterwards.
 */
public final class PluginDescriptor {

    private final String name;
    private final AuthType authType;
    private final JsonSchema configSchema;
    private final String communityPlatformIdKey;
    private final Map<String, ActionDefinition> actions;
    private final Map<String, ProcessDefinition> processes;
    private final PluginInitializer initializer;

    private PluginDescriptor(Builder b) {
        this.name = b.name;
        this.authType = b.authType;
        this.configSchema = b.configSchema;
        this.communityPlatformIdKey = b.communityPlatformIdKey;
        this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(b.actions));
        this.processes = Collections.unmodifiableMap(new LinkedHashMap<>(b.processes));
        this.initializer = b.initializer;
    }

    public String getName() {
        return name;
    }

    public AuthType getAuthType() {
        return authType;
    }

    /** Config schema; null = config not validated. */
    public JsonSchema getConfigSchema() {
        return configSchema;
    }

    /** Config key whose value disambiguates several instances in one community; null if none. */
    public String getCommunityPlatformIdKey() {
        return communityPlatformIdKey;
    }

    public Optional<ActionDefinition> getAction(String actionId) {
        return Optional.ofNullable(actionId != null ? actions.get(actionId) : null);
    }

    public Map<String, ActionDefinition> getActions() {
        return actions;
    }

    public Optional<ProcessDefinition> getProcess(String processName) {
        return Optional.ofNullable(processName != null ? processes.get(processName) : null);
    }

    public Set<String> getProcessNames() {
        return processes.keySet();
    }

    public PluginInitializer getInitializer() {
        return initializer;
    }

    /**
     * Capability listing handed to the driver: auth mode, config schema, and each action and process type
     * with its description and schemas. Absent schemas are null.
     */
    public Map<String, Object> describe() {
        List<Map<String, Object>> actionList = new ArrayList<>();
        for (ActionDefinition action : actions.values()) {
            Map<String, Object> a = new LinkedHashMap<>();
            a.put("id", action.id());
            a.put("description", action.description());
            a.put("input_schema", schemaMap(action.inputSchema()));
            a.put("output_schema", schemaMap(action.outputSchema()));
            actionList.add(a);
        }
        List<Map<String, Object>> processList = new ArrayList<>();
        for (ProcessDefinition process : processes.values()) {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("name", process.getName());
            p.put("description", process.getDescription());
            p.put("input_schema", schemaMap(process.getInputSchema()));
            p.put("outcome_schema", schemaMap(process.getOutcomeSchema()));
            processList.add(p);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", name);
        out.put("auth_type", authType.value());
        out.put("config_schema", schemaMap(configSchema));
        out.put("actions", actionList);
        out.put("processes", processList);
        return out;
    }

    private static Map<String, Object> schemaMap(JsonSchema schema) {
        return schema != null ? schema.toMap() : null;
    }

    @Override
    public String toString() {
        return "PluginDescriptor{" + name + ", auth=" + authType.value()
                + ", actions=" + actions.keySet() + ", processes=" + processes.keySet() + "}";
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private AuthType authType = AuthType.NONE;
        private JsonSchema configSchema;
        private String communityPlatformIdKey;
        private final Map<String, ActionDefinition> actions = new LinkedHashMap<>();
        private final Map<String, ProcessDefinition> processes = new LinkedHashMap<>();
        private PluginInitializer initializer = PluginInitializer.NO_OP;

        private Builder(String name) {
            String n = Objects.requireNonNull(name, "name").trim();
            if (n.isEmpty()) {
                throw new IllegalArgumentException("Plugin name must be non-blank");
            }
            this.name = n;
        }

        public Builder authType(AuthType authType) {
            this.authType = Objects.requireNonNull(authType, "authType");
            return this;
        }

        public Builder configSchema(JsonSchema configSchema) {
            this.configSchema = configSchema;
            return this;
        }

        public Builder communityPlatformIdKey(String key) {
            this.communityPlatformIdKey = key;
            return this;
        }

        /** @throws IllegalArgumentException if the action id is already declared */
        public Builder action(ActionDefinition action) {
            Objects.requireNonNull(action, "action");
            if (actions.putIfAbsent(action.id(), action) != null) {
                throw new IllegalArgumentException("Action already declared for plugin " + name + ": " + action.id());
            }
            return this;
        }

        /** @throws IllegalArgumentException if the process type is already declared */
        public Builder process(ProcessDefinition process) {
            Objects.requireNonNull(process, "process");
            if (processes.putIfAbsent(process.getName(), process) != null) {
                throw new IllegalArgumentException("Process already declared for plugin " + name + ": " + process.getName());
            }
            return this;
        }

        public Builder initializer(PluginInitializer initializer) {
            this.initializer = initializer != null ? initializer : PluginInitializer.NO_OP;
            return this;
        }

        public PluginDescriptor build() {
            return new PluginDescriptor(this);
        }
    }
}
