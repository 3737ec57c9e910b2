package com.metagov.plugin.poll;

import com.metagov.community.Community;
import com.metagov.community.CommunityRepository;
import com.metagov.config.MetagovConfig;
import com.metagov.errors.InvalidParametersException;
import com.metagov.events.EventEmitter;
import com.metagov.events.PlatformEvent;
import com.metagov.identity.IdentityResolutionEngine;
import com.metagov.identity.LinkQuality;
import com.metagov.identity.LinkedAccount;
import com.metagov.plugin.ActionDispatcher;
import com.metagov.plugin.PluginInstance;
import com.metagov.plugin.PluginInstanceManager;
import com.metagov.plugin.PluginRegistry;
import com.metagov.plugin.ProcessStatus;
import com.metagov.process.GovernanceProcess;
import com.metagov.process.GovernanceProcessEngine;
import com.metagov.state.StateStoreRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PollPluginTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final List<PlatformEvent> events = new ArrayList<>();
    private final IdentityResolutionEngine identity = new IdentityResolutionEngine();
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private PluginInstanceManager instances;
    private GovernanceProcessEngine engine;
    private ActionDispatcher dispatcher;
    private Community acme;

    @BeforeEach
    void setUp() {
        MetagovConfig config = MetagovConfig.builder().pollBaseUrl("https://polls.test/").build();
        PluginRegistry registry = new PluginRegistry();
        registry.register(new PollPluginProvider(config, Clock.fixed(NOW, ZoneOffset.UTC)));
        registry.freeze();
        EventEmitter emitter = new EventEmitter(null);
        emitter.addListener(events::add);
        StateStoreRepository stateStores = new StateStoreRepository();
        instances = new PluginInstanceManager(registry, stateStores, emitter, identity);
        engine = new GovernanceProcessEngine(instances, stateStores, meters, Duration.ofSeconds(5));
        dispatcher = new ActionDispatcher(registry, instances, meters);
        acme = new CommunityRepository().create("acme", "Acme");
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private PluginInstance enablePoll() {
        return instances.enable("poll", acme, Map.of("apiKey", "x"));
    }

    @Test
    void enable_requiresApiKey() {
        InvalidParametersException e = assertThrows(InvalidParametersException.class,
                () -> instances.enable("poll", acme, Map.of()));

        assertTrue(e.getViolations().get(0).contains("apiKey"));
    }

    @Test
    void vote_startsPendingWithPollUrl() {
        GovernanceProcess vote = engine.startProcess(enablePoll(), "vote", null, Map.of("title", "T"));

        assertEquals(ProcessStatus.PENDING, vote.getStatus());
        String url = (String) vote.getOutcome().get("url");
        assertTrue(url.startsWith("https://polls.test/votes/"));
        assertEquals(url, vote.getUrl());
        assertEquals(Map.of("yes", 0, "no", 0), vote.getOutcome().get("votes"));
        assertEquals("vote_started", events.get(0).eventType());
        assertEquals("poll", events.get(0).source());
    }

    @Test
    void vote_resultWebhookCompletesAndLaterUpdateIsNoOp() {
        PluginInstance poll = enablePoll();
        GovernanceProcess vote = engine.startProcess(poll, "vote", null, Map.of("title", "T"));
        String voteId = (String) vote.getOutcome().get("vote_id");

        GovernanceProcess foreign = engine.receiveWebhook(vote.getId(), Map.of("voteId", "other", "result", "no"));
        assertEquals(ProcessStatus.PENDING, foreign.getStatus());

        GovernanceProcess done = engine.receiveWebhook(vote.getId(), Map.of("voteId", voteId, "result", "yes"));
        assertEquals(ProcessStatus.COMPLETED, done.getStatus());
        assertEquals("yes", done.getOutcome().get("result"));

        GovernanceProcess afterUpdate = engine.update(vote.getId());
        assertEquals(done.getOutcome(), afterUpdate.getOutcome());
        assertEquals(ProcessStatus.COMPLETED, afterUpdate.getStatus());
        assertEquals("vote_closed", events.get(events.size() - 1).eventType());
    }

    @Test
    void vote_ballotsAreCountedAndVotersLinked() {
        PluginInstance poll = enablePoll();
        GovernanceProcess vote = engine.startProcess(poll, "vote", null,
                Map.of("title", "Lunch", "options", List.of("pizza", "tacos")));
        String voteId = (String) vote.getOutcome().get("vote_id");

        engine.routeWebhook(poll, Map.of("voteId", voteId, "voter", "alice", "vote", "tacos"));
        engine.routeWebhook(poll, Map.of("voteId", voteId, "voter", "bob", "vote", "pizza"));
        engine.routeWebhook(poll, Map.of("voteId", voteId, "voter", "carol", "vote", "tacos"));
        GovernanceProcess closed = engine.close(vote.getId());

        assertEquals(Map.of("pizza", 1, "tacos", 2), closed.getOutcome().get("votes"));
        assertEquals("tacos", closed.getOutcome().get("result"));
        assertEquals(3, identity.accountCount());
        LinkedAccount alice = identity.retrieveAccount(acme, "poll", "alice", null);
        assertEquals(LinkQuality.UNCONFIRMED, alice.getLinkQuality());
    }

    @Test
    void vote_unknownOptionIsRecordedAsError() {
        GovernanceProcess vote = engine.startProcess(enablePoll(), "vote", null, Map.of("title", "T"));
        String voteId = (String) vote.getOutcome().get("vote_id");

        GovernanceProcess after = engine.receiveWebhook(vote.getId(), Map.of("voteId", voteId, "result", "maybe"));

        assertEquals(ProcessStatus.PENDING, after.getStatus());
        assertEquals("invalid_option", after.getErrors().get("code"));
    }

    @Test
    void vote_updateClosesOnceClosingTimeHasPassed() {
        PluginInstance poll = enablePoll();
        GovernanceProcess open = engine.startProcess(poll, "vote", null,
                Map.of("title", "Later", "closing_at", "2026-03-02T00:00:00Z"));
        GovernanceProcess due = engine.startProcess(poll, "vote", null,
                Map.of("title", "Now", "closing_at", "2026-03-01T11:00:00Z"));

        assertEquals(ProcessStatus.PENDING, engine.update(open.getId()).getStatus());
        GovernanceProcess closed = engine.update(due.getId());
        assertEquals(ProcessStatus.COMPLETED, closed.getStatus());
        assertNull(closed.getOutcome().get("result"));
        assertTrue(closed.getOutcome().containsKey("result"));
    }

    @Test
    void vote_badClosingTimeIsRejectedAndNothingPersists() {
        PluginInstance poll = enablePoll();

        assertThrows(InvalidParametersException.class,
                () -> engine.startProcess(poll, "vote", null, Map.of("title", "T", "closing_at", "tomorrow")));
        assertTrue(engine.listProcesses(poll, "vote").isEmpty());
    }

    @Test
    void linkVoter_upgradesUnconfirmedVoterToWeakWhenEmailKnown() {
        PluginInstance poll = enablePoll();
        dispatcher.dispatch(poll, "link-voter", Map.of("voter", "alice"), true);

        @SuppressWarnings("unchecked")
        Map<String, Object> view = (Map<String, Object>) dispatcher.dispatch(poll, "link-voter",
                Map.of("voter", "alice", "email", "alice@acme.org"), true);

        assertEquals("confirmed (weak)", view.get("link_quality"));
        assertEquals("email matching", view.get("link_type"));
        assertEquals(Map.of("email", "alice@acme.org"), view.get("custom_data"));
        assertEquals(1, identity.accountCount());
    }
}
