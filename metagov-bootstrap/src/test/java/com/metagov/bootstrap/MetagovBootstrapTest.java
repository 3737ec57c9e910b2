package com.metagov.bootstrap;

import com.metagov.community.Community;
import com.metagov.config.MetagovConfig;
import com.metagov.errors.NotFoundException;
import com.metagov.errors.PluginNotFoundException;
import com.metagov.errors.ProcessNotFoundException;
import com.metagov.events.PlatformEvent;
import com.metagov.identity.LinkOptions;
import com.metagov.identity.LinkQuality;
import com.metagov.identity.LinkType;
import com.metagov.identity.LinkedAccount;
import com.metagov.identity.MetagovId;
import com.metagov.plugin.PluginDescriptor;
import com.metagov.plugin.PluginInstance;
import com.metagov.plugin.ProcessStatus;
import com.metagov.process.GovernanceProcess;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetagovBootstrapTest {

    private Metagov metagov;
    private final List<PlatformEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        metagov = MetagovBootstrap.initialize(MetagovConfig.builder()
                .pollBaseUrl("https://polls.test")
                .processStartTimeoutSeconds(5)
                .sweepParallelism(2)
                .build());
        metagov.getEvents().addListener(events::add);
        metagov.createCommunity("acme", "Acme");
    }

    @AfterEach
    void tearDown() {
        metagov.shutdown();
    }

    @Test
    void initialize_registersPollOnceAndFreezesRegistry() {
        assertEquals(List.of("poll"), metagov.getRegistry().names());
        assertTrue(metagov.getRegistry().isFrozen());
        assertThrows(IllegalStateException.class,
                () -> metagov.getRegistry().register(PluginDescriptor.builder("late").build()));
    }

    @Test
    void listAvailablePlugins_describesPollCapabilities() {
        List<Map<String, Object>> listing = metagov.listAvailablePlugins();

        assertEquals(1, listing.size());
        Map<String, Object> poll = listing.get(0);
        assertEquals("api_key", poll.get("auth_type"));
        List<?> actions = (List<?>) poll.get("actions");
        Map<?, ?> linkVoter = (Map<?, ?>) actions.get(0);
        assertEquals("link-voter", linkVoter.get("id"));
        assertEquals("Link a poll voter to a Metagov identity", linkVoter.get("description"));
        assertEquals("object", ((Map<?, ?>) linkVoter.get("input_schema")).get("type"));
        Map<?, ?> vote = (Map<?, ?>) ((List<?>) poll.get("processes")).get(0);
        assertEquals("vote", vote.get("name"));
        assertEquals("Yes/no or multiple choice vote on a hosted poll", vote.get("description"));
        assertNotNull(vote.get("outcome_schema"));
        assertTrue(((Map<?, ?>) poll.get("config_schema")).containsKey("required"));
    }

    @Test
    void pollVoteScenario() {
        PluginInstance poll = metagov.enablePlugin("acme", "poll", Map.of("apiKey", "x"));
        assertEquals("api_key", poll.serialize().get("auth_type"));

        GovernanceProcess vote = metagov.startProcess("acme", "poll", "vote", "https://driver.test/cb",
                Map.of("title", "T"), null);
        assertEquals(ProcessStatus.PENDING, vote.getStatus());
        assertTrue(((String) vote.getOutcome().get("url")).startsWith("https://polls.test/votes/"));

        int routed = metagov.receiveWebhook("acme", "poll", null,
                Map.of("voteId", vote.getOutcome().get("vote_id"), "result", "yes"));
        assertEquals(1, routed);
        GovernanceProcess done = metagov.getProcess("acme", "poll", "vote", vote.getId(), null);
        assertEquals(ProcessStatus.COMPLETED, done.getStatus());
        assertEquals("yes", done.getOutcome().get("result"));

        GovernanceProcess afterUpdate = metagov.getProcesses().update(vote.getId());
        assertEquals(done.getOutcome(), afterUpdate.getOutcome());
        assertEquals(0, metagov.runUpdateSweep());
        assertEquals(1.0, metagov.getMeters().counter("metagov.process.completed",
                "plugin", "poll", "process", "vote").count());
        assertEquals(List.of("vote_started", "vote_closed"),
                events.stream().map(PlatformEvent::eventType).collect(java.util.stream.Collectors.toList()));
    }

    @Test
    void getProcess_underAnotherTypeIsNotFound() {
        metagov.enablePlugin("acme", "poll", Map.of("apiKey", "x"));
        GovernanceProcess vote = metagov.startProcess("acme", "poll", "vote", null, Map.of("title", "T"), null);

        assertThrows(ProcessNotFoundException.class,
                () -> metagov.getProcess("acme", "poll", "election", vote.getId(), null));
    }

    @Test
    void linkThenUpgradeThroughPlugin() {
        PluginInstance poll = metagov.enablePlugin("acme", "poll", Map.of("apiKey", "x"));
        Community acme = metagov.getCommunity("acme");
        MetagovId id = metagov.createId("acme");
        metagov.getIdentity().linkAccount(id.getExternalId(), acme, "poll", "U123", null,
                LinkOptions.of(LinkType.MANUAL_ADMIN, LinkQuality.UNCONFIRMED));

        LinkedAccount upgraded = metagov.getPlugins().contextFor(poll)
                .addLinkedAccount("U123", LinkOptions.of(LinkType.OAUTH, LinkQuality.STRONG_CONFIRM));

        assertEquals(LinkQuality.STRONG_CONFIRM, upgraded.getLinkQuality());
        assertEquals(LinkType.OAUTH, upgraded.getLinkType());
        assertEquals(id.getExternalId(), upgraded.getExternalId());
        assertEquals(1, metagov.getLinkedAccounts("acme", id.getExternalId()).size());
    }

    @Test
    void concurrentFirstLinksCreateOneAccount() throws Exception {
        metagov.enablePlugin("acme", "poll", Map.of("apiKey", "x"));
        int threads = 8;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Callable<Object>> calls = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            calls.add(() -> {
                go.await();
                return metagov.performAction("acme", "poll", "link-voter", Map.of("voter", "newcomer"), true, null);
            });
        }
        try {
            List<Future<Object>> futures = new ArrayList<>();
            for (Callable<Object> c : calls) {
                futures.add(pool.submit(c));
            }
            go.countDown();
            Set<Object> externalIds = new HashSet<>();
            for (Future<Object> f : futures) {
                externalIds.add(((Map<?, ?>) f.get()).get("external_id"));
            }
            assertEquals(1, externalIds.size());
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, metagov.getIdentity().accountCount());
    }

    @Test
    void deleteCommunity_cascadesEverything() {
        metagov.enablePlugin("acme", "poll", Map.of("apiKey", "x"));
        metagov.startProcess("acme", "poll", "vote", null, Map.of("title", "T"), null);
        metagov.performAction("acme", "poll", "link-voter", Map.of("voter", "alice"), true, null);

        metagov.deleteCommunity("acme");

        assertThrows(NotFoundException.class, () -> metagov.getCommunity("acme"));
        assertEquals(0, metagov.getProcesses().processCount());
        assertEquals(0, metagov.getStateStores().size());
        assertEquals(0, metagov.getIdentity().accountCount());
        assertTrue(metagov.getPlugins().listAll().isEmpty());
    }

    @Test
    void disabledPluginIsNotFound() {
        metagov.enablePlugin("acme", "poll", Map.of("apiKey", "x"));
        metagov.disablePlugin("acme", "poll", null, null);

        assertThrows(PluginNotFoundException.class,
                () -> metagov.startProcess("acme", "poll", "vote", null, Map.of("title", "T"), null));
        assertThrows(PluginNotFoundException.class, () -> metagov.enablePlugin("acme", "slack", Map.of()));
    }
}
