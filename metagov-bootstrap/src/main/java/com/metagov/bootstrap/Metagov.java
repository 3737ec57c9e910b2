package com.metagov.bootstrap;

import com.metagov.community.Community;
import com.metagov.community.CommunityRepository;
import com.metagov.config.MetagovConfig;
import com.metagov.events.EventEmitter;
import com.metagov.identity.IdentityResolutionEngine;
import com.metagov.identity.LinkedAccount;
import com.metagov.identity.MetagovId;
import com.metagov.plugin.ActionDispatcher;
import com.metagov.plugin.PluginInstance;
import com.metagov.plugin.PluginInstanceManager;
import com.metagov.plugin.PluginRegistry;
import com.metagov.process.GovernanceProcess;
import com.metagov.process.GovernanceProcessEngine;
import com.metagov.process.ProcessUpdateSweep;
import com.metagov.state.StateStoreRepository;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Map;

/**
 * Runtime facade used by the boundary layer. Calls are addressed by community slug and plugin name
 * (plus community platform id when several instances of a plugin exist in one community).
 */
public final class Metagov {

    private final MetagovConfig config;
    private final PluginRegistry registry;
    private final CommunityRepository communities;
    private final StateStoreRepository stateStores;
    private final IdentityResolutionEngine identity;
    private final PluginInstanceManager plugins;
    private final ActionDispatcher dispatcher;
    private final GovernanceProcessEngine processes;
    private final ProcessUpdateSweep sweep;
    private final EventEmitter events;
    private final MeterRegistry meters;

    Metagov(MetagovConfig config, PluginRegistry registry, CommunityRepository communities,
            StateStoreRepository stateStores, IdentityResolutionEngine identity, PluginInstanceManager plugins,
            ActionDispatcher dispatcher, GovernanceProcessEngine processes, ProcessUpdateSweep sweep,
            EventEmitter events, MeterRegistry meters) {
        this.config = config;
        this.registry = registry;
        this.communities = communities;
        this.stateStores = stateStores;
        this.identity = identity;
        this.plugins = plugins;
        this.dispatcher = dispatcher;
        this.processes = processes;
        this.sweep = sweep;
        this.events = events;
        this.meters = meters;
    }

    public Community createCommunity(String slug, String readableName) {
        return communities.create(slug, readableName);
    }

    public Community getCommunity(String slug) {
        return communities.get(slug);
    }

    public List<Community> listCommunities() {
        return communities.list();
    }

    /** Deletes the community with its plugins, processes, state stores and identities. */
    public void deleteCommunity(String slug) {
        communities.delete(slug);
    }

    public PluginInstance enablePlugin(String communitySlug, String pluginName, Map<String, Object> config) {
        return plugins.enable(pluginName, communities.get(communitySlug), config);
    }

    public PluginInstance getPlugin(String communitySlug, String pluginName, String communityPlatformId) {
        return plugins.get(pluginName, communities.get(communitySlug), communityPlatformId, null);
    }

    public PluginInstance disablePlugin(String communitySlug, String pluginName, String communityPlatformId, Long id) {
        return plugins.disable(pluginName, communities.get(communitySlug), communityPlatformId, id);
    }

    public List<PluginInstance> listPlugins(String communitySlug) {
        return plugins.list(communities.get(communitySlug));
    }

    /** Actions and process types of every registered plugin, with descriptions and schemas. */
    public List<Map<String, Object>> listAvailablePlugins() {
        return registry.describeAll();
    }

    public Object performAction(String communitySlug, String pluginName, String actionId, Map<String, Object> parameters,
                                boolean validate, String communityPlatformId) {
        PluginInstance instance = getPlugin(communitySlug, pluginName, communityPlatformId);
        return dispatcher.dispatch(instance, actionId, parameters, validate);
    }

    public GovernanceProcess startProcess(String communitySlug, String pluginName, String processName,
                                          String callbackUrl, Map<String, Object> parameters,
                                          String communityPlatformId) {
        PluginInstance instance = getPlugin(communitySlug, pluginName, communityPlatformId);
        return processes.startProcess(instance, processName, callbackUrl, parameters);
    }

    public GovernanceProcess getProcess(String communitySlug, String pluginName, String processName, long processId,
                                        String communityPlatformId) {
        return processes.getProcess(getPlugin(communitySlug, pluginName, communityPlatformId), processName, processId);
    }

    /** Closes the process after checking it belongs to the addressed plugin and type. */
    public GovernanceProcess closeProcess(String communitySlug, String pluginName, String processName, long processId,
                                          String communityPlatformId) {
        GovernanceProcess process = getProcess(communitySlug, pluginName, processName, processId, communityPlatformId);
        return processes.close(process.getId());
    }

    public List<GovernanceProcess> listProcesses(String communitySlug, String pluginName, String processName,
                                                 String communityPlatformId) {
        return processes.listProcesses(getPlugin(communitySlug, pluginName, communityPlatformId), processName);
    }

    /**
     * Routes an inbound platform webhook to the open processes of the addressed plugin.
     *
     * @return number of processes that saw the payload
     */
    public int receiveWebhook(String communitySlug, String pluginName, String communityPlatformId,
                              Map<String, Object> payload) {
        return processes.routeWebhook(getPlugin(communitySlug, pluginName, communityPlatformId), payload);
    }

    /** Runs one update sweep over pending processes; returns how many completed. */
    public int runUpdateSweep() {
        return sweep.runOnce();
    }

    public MetagovId createId(String communitySlug) {
        return identity.createId(communities.get(communitySlug));
    }

    public List<LinkedAccount> getLinkedAccounts(String communitySlug, long externalId) {
        return identity.getLinkedAccounts(communities.get(communitySlug), externalId);
    }

    public MetagovId mergeIds(String communitySlug, long externalIdA, long externalIdB) {
        return identity.mergeIds(communities.get(communitySlug), externalIdA, externalIdB);
    }

    public MetagovConfig getConfig() {
        return config;
    }

    public PluginRegistry getRegistry() {
        return registry;
    }

    public StateStoreRepository getStateStores() {
        return stateStores;
    }

    public IdentityResolutionEngine getIdentity() {
        return identity;
    }

    public PluginInstanceManager getPlugins() {
        return plugins;
    }

    public GovernanceProcessEngine getProcesses() {
        return processes;
    }

    public EventEmitter getEvents() {
        return events;
    }

    public MeterRegistry getMeters() {
        return meters;
    }

    /** Stops worker threads. */
    public void shutdown() {
        sweep.shutdown();
        processes.shutdown();
    }
}
