package com.metagov.plugin;

import com.metagov.community.Community;
import com.metagov.identity.PlatformScope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One configured integration of a plugin type for one community. Immutable; re-enabling produces a
 * copy with the new config. Unique per (plugin name, community, community platform id).
 */
public final class PluginInstance implements PlatformScope {

    private final long id;
    private final String pluginName;
    private final AuthType authType;
    private final Community community;
    private final String communityPlatformId;
    private final Map<String, Object> config;
    private final long stateId;

    PluginInstance(long id, String pluginName, AuthType authType, Community community, String communityPlatformId,
                   Map<String, Object> config, long stateId) {
        this.id = id;
        this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        this.authType = authType != null ? authType : AuthType.NONE;
        this.community = Objects.requireNonNull(community, "community");
        this.communityPlatformId = communityPlatformId;
        this.config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
        this.stateId = stateId;
    }

    PluginInstance withConfig(Map<String, Object> newConfig) {
        return new PluginInstance(id, pluginName, authType, community, communityPlatformId, newConfig, stateId);
    }

    public long getId() {
        return id;
    }

    public String getPluginName() {
        return pluginName;
    }

    public AuthType getAuthType() {
        return authType;
    }

    @Override
    public Community getCommunity() {
        return community;
    }

    @Override
    public String getPlatformType() {
        return pluginName;
    }

    @Override
    public String getCommunityPlatformId() {
        return communityPlatformId;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    /** Id of the instance's private state store. */
    public long getStateId() {
        return stateId;
    }

    /** Public view sent to the driver. */
    public Map<String, Object> serialize() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", id);
        out.put("name", pluginName);
        out.put("community", community.getSlug());
        out.put("community_platform_id", communityPlatformId);
        out.put("config", config);
        out.put("auth_type", authType.value());
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PluginInstance)) return false;
        return id == ((PluginInstance) o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        if (communityPlatformId != null) {
            return pluginName + " (" + communityPlatformId + ") for '" + community + "'";
        }
        return pluginName + " for '" + community + "'";
    }
}
