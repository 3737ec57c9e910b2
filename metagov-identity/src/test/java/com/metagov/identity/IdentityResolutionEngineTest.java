package com.metagov.identity;

import com.metagov.community.Community;
import com.metagov.errors.AccountNotFoundException;
import com.metagov.errors.DuplicateLinkException;
import com.metagov.errors.IntegrityViolationException;
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
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdentityResolutionEngineTest {

    private static final Community ACME = new Community(1, "acme", "Acme");
    private static final Community OTHER = new Community(2, "other", "");
    private static final PlatformScope SLACK = new Scope(ACME, "slack", null);

    private IdentityResolutionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new IdentityResolutionEngine();
    }

    @Test
    void createId_isPrimaryWithoutLinks() {
        MetagovId id = engine.createId(ACME);

        assertTrue(id.isPrimary());
        assertFalse(id.hasLinks());
        assertTrue(id.getExternalId() > 0);
        assertNotEquals(id.getExternalId(), engine.createId(ACME).getExternalId());
    }

    @Test
    void linkAccount_thenRetrieve() {
        long ext = engine.createId(ACME).getExternalId();

        engine.linkAccount(ext, ACME, "slack", "U123", null,
                new LinkOptions(null, Map.of("name", "Ada"), LinkType.OAUTH, LinkQuality.WEAK_CONFIRM));

        LinkedAccount account = engine.retrieveAccount(ACME, "slack", "U123", null);
        assertEquals(ext, account.getExternalId());
        assertEquals(Map.of("name", "Ada"), account.getCustomData());
        assertEquals(LinkType.OAUTH, account.getLinkType());
        assertThrows(AccountNotFoundException.class, () -> engine.retrieveAccount(ACME, "slack", "U123", "T2"));
        assertThrows(AccountNotFoundException.class, () -> engine.retrieveAccount(OTHER, "slack", "U123", null));
    }

    @Test
    void linkAccount_rejectsDuplicateTuple() {
        long first = engine.createId(ACME).getExternalId();
        long second = engine.createId(ACME).getExternalId();
        engine.linkAccount(first, ACME, "slack", "U123", null, LinkOptions.none());

        assertThrows(DuplicateLinkException.class,
                () -> engine.linkAccount(second, ACME, "slack", "U123", null, LinkOptions.none()));
        assertEquals(first, engine.retrieveAccount(ACME, "slack", "U123", null).getExternalId());
    }

    @Test
    void linkAccount_sameIdentifierInAnotherWorkspaceIsDistinct() {
        long ext = engine.createId(ACME).getExternalId();
        engine.linkAccount(ext, ACME, "slack", "U123", "T1", LinkOptions.none());
        engine.linkAccount(ext, ACME, "slack", "U123", "T2", LinkOptions.none());

        assertEquals(2, engine.getLinkedAccounts(ACME, ext).size());
    }

    @Test
    void linkAccount_unknownExternalId() {
        assertThrows(AccountNotFoundException.class,
                () -> engine.linkAccount(123456789L, ACME, "slack", "U1", null, LinkOptions.none()));
    }

    @Test
    void addLinkedAccount_upgradesInPlaceOnHigherQuality() {
        long ext = engine.createId(ACME).getExternalId();
        LinkedAccount original = engine.linkAccount(ext, ACME, "slack", "U123", null,
                new LinkOptions(null, Map.of("source", "guess"), LinkType.EMAIL_MATCHING, LinkQuality.UNCONFIRMED));

        LinkedAccount upgraded = engine.addLinkedAccount(SLACK, "U123",
                new LinkOptions(null, Map.of("source", "oauth"), LinkType.OAUTH, LinkQuality.STRONG_CONFIRM));

        assertEquals(original.getId(), upgraded.getId());
        assertEquals(ext, upgraded.getExternalId());
        assertEquals(LinkQuality.STRONG_CONFIRM, upgraded.getLinkQuality());
        assertEquals(LinkType.OAUTH, upgraded.getLinkType());
        assertEquals(Map.of("source", "oauth"), upgraded.getCustomData());
        assertEquals("confirmed (strong)", engine.retrieveAccount(ACME, "slack", "U123", null).serialize().get("link_quality"));
    }

    @Test
    void addLinkedAccount_ignoresEqualOrLowerQuality() {
        LinkedAccount stored = engine.addLinkedAccount(SLACK, "U9",
                new LinkOptions(null, Map.of("v", 1), LinkType.OAUTH, LinkQuality.STRONG_CONFIRM));

        LinkedAccount afterWeak = engine.addLinkedAccount(SLACK, "U9",
                new LinkOptions(null, Map.of("v", 2), LinkType.MANUAL_ADMIN, LinkQuality.WEAK_CONFIRM));
        LinkedAccount afterEqual = engine.addLinkedAccount(SLACK, "U9",
                new LinkOptions(null, Map.of("v", 3), LinkType.MANUAL_ADMIN, LinkQuality.STRONG_CONFIRM));
        LinkedAccount afterNone = engine.addLinkedAccount(SLACK, "U9", LinkOptions.none());

        assertEquals(stored, afterWeak);
        assertEquals(stored, afterEqual);
        assertEquals(stored, afterNone);
        assertEquals(Map.of("v", 1), engine.retrieveAccount(ACME, "slack", "U9", null).getCustomData());
    }

    @Test
    void addLinkedAccount_createsIdWhenNoneGiven() {
        LinkedAccount account = engine.addLinkedAccount(SLACK, "U1", LinkOptions.of(LinkType.UNKNOWN, LinkQuality.UNCONFIRMED));

        MetagovId owner = engine.getIdentity(ACME, account.getExternalId());
        assertTrue(owner.isPrimary());
        assertEquals("slack", account.getPlatformType());
    }

    @Test
    void addLinkedAccount_usesGivenExternalId() {
        long ext = engine.createId(ACME).getExternalId();

        LinkedAccount account = engine.addLinkedAccount(new Scope(ACME, "github", null), "ada",
                LinkOptions.none().withExternalId(ext));

        assertEquals(ext, account.getExternalId());
    }

    @Test
    void addLinkedAccount_concurrentCallsCreateExactlyOneAccount() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<LinkedAccount>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Callable<LinkedAccount> call = () -> {
                    start.await();
                    return engine.addLinkedAccount(SLACK, "U-race", LinkOptions.of(LinkType.OAUTH, LinkQuality.UNCONFIRMED));
                };
                futures.add(pool.submit(call));
            }
            start.countDown();
            Set<Long> accountIds = new HashSet<>();
            for (Future<LinkedAccount> f : futures) {
                accountIds.add(f.get(10, TimeUnit.SECONDS).getId());
            }
            assertEquals(1, accountIds.size());
            assertEquals(1, engine.accountCount());
            assertEquals(0, engine.lockedTupleCount());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void updateLinkedAccount_changesOnlySuppliedFields() {
        long ext = engine.createId(ACME).getExternalId();
        engine.linkAccount(ext, ACME, "slack", "U1", null,
                new LinkOptions(null, Map.of("a", 1), LinkType.OAUTH, LinkQuality.WEAK_CONFIRM));

        LinkedAccount updated = engine.updateLinkedAccount(ACME, "slack", "U1", null,
                LinkOptions.none().withCustomData(Map.of("b", 2)));

        assertEquals(Map.of("b", 2), updated.getCustomData());
        assertEquals(LinkType.OAUTH, updated.getLinkType());
        assertEquals(LinkQuality.WEAK_CONFIRM, updated.getLinkQuality());
    }

    @Test
    void mergeIds_rejectsTwoPrimariesAndLeavesIdsUntouched() {
        MetagovId a = engine.createId(ACME);
        MetagovId b = engine.createId(ACME);

        assertThrows(IntegrityViolationException.class, () -> engine.mergeIds(ACME, a.getExternalId(), b.getExternalId()));

        assertFalse(engine.getIdentity(ACME, a.getExternalId()).hasLinks());
        assertFalse(engine.getIdentity(ACME, b.getExternalId()).hasLinks());
    }

    @Test
    void mergeIds_rejectsZeroPrimariesAndLeavesIdsUntouched() {
        MetagovId a = engine.createId(ACME);
        MetagovId b = engine.createId(ACME);
        engine.setPrimary(ACME, a.getExternalId(), false);
        engine.setPrimary(ACME, b.getExternalId(), false);

        IntegrityViolationException e = assertThrows(IntegrityViolationException.class,
                () -> engine.mergeIds(ACME, a.getExternalId(), b.getExternalId()));

        assertTrue(e.getMessage().contains("At least one"));
        assertFalse(engine.getIdentity(ACME, a.getExternalId()).hasLinks());
        assertFalse(engine.getIdentity(ACME, b.getExternalId()).hasLinks());
        assertFalse(engine.getIdentity(ACME, a.getExternalId()).getPrimaryFlag());
    }

    @Test
    void accountLocks_areReleasedAfterLookupsAndUpgrades() {
        engine.addLinkedAccount(SLACK, "U1", LinkOptions.of(LinkType.OAUTH, LinkQuality.UNCONFIRMED));
        engine.addLinkedAccount(SLACK, "U1", LinkOptions.of(LinkType.OAUTH, LinkQuality.STRONG_CONFIRM));
        engine.addLinkedAccount(SLACK, "U1", LinkOptions.none());

        assertEquals(0, engine.lockedTupleCount());
    }

    @Test
    void mergeIds_joinsGroupsAndResolvesPrimary() {
        MetagovId a = engine.createId(ACME);
        MetagovId b = engine.createId(ACME);
        engine.linkAccount(a.getExternalId(), ACME, "slack", "U1", null, LinkOptions.none());
        engine.linkAccount(b.getExternalId(), ACME, "github", "ada", null, LinkOptions.none());
        engine.setPrimary(ACME, b.getExternalId(), false);
        assertTrue(engine.isPrimary(b));

        MetagovId primary = engine.mergeIds(ACME, a.getExternalId(), b.getExternalId());

        assertEquals(a.getExternalId(), primary.getExternalId());
        assertFalse(engine.isPrimary(b));
        assertEquals(a.getExternalId(), engine.getPrimaryId(ACME, b.getExternalId()).getExternalId());
        assertEquals(2, engine.getLinkedAccounts(ACME, b.getExternalId()).size());
        assertEquals(primary, engine.mergeIds(ACME, b.getExternalId(), a.getExternalId()));
    }

    @Test
    void mergeIds_thirdMemberLinksWholeGroup() {
        MetagovId a = engine.createId(ACME);
        MetagovId b = engine.createId(ACME);
        MetagovId c = engine.createId(ACME);
        engine.setPrimary(ACME, b.getExternalId(), false);
        engine.mergeIds(ACME, a.getExternalId(), b.getExternalId());

        assertThrows(IntegrityViolationException.class, () -> engine.mergeIds(ACME, b.getExternalId(), c.getExternalId()));

        engine.setPrimary(ACME, c.getExternalId(), false);
        engine.mergeIds(ACME, b.getExternalId(), c.getExternalId());
        MetagovId cNow = engine.getIdentity(ACME, c.getExternalId());
        assertEquals(2, cNow.getLinkedIds().size());
        assertEquals(a.getExternalId(), engine.getPrimaryId(cNow).getExternalId());
        assertExactlyOnePrimary(List.of(a, b, c));
    }

    @Test
    void setPrimary_insideGroupMustKeepExactlyOnePrimary() {
        MetagovId a = engine.createId(ACME);
        MetagovId b = engine.createId(ACME);
        engine.setPrimary(ACME, b.getExternalId(), false);
        engine.mergeIds(ACME, a.getExternalId(), b.getExternalId());

        assertThrows(IntegrityViolationException.class, () -> engine.setPrimary(ACME, a.getExternalId(), false));
        assertThrows(IntegrityViolationException.class, () -> engine.setPrimary(ACME, b.getExternalId(), true));

        engine.makePrimary(ACME, b.getExternalId());
        assertEquals(b.getExternalId(), engine.getPrimaryId(ACME, a.getExternalId()).getExternalId());
        assertExactlyOnePrimary(List.of(a, b));
    }

    @Test
    void mergeIds_acrossCommunitiesIsNotFound() {
        MetagovId a = engine.createId(ACME);
        MetagovId b = engine.createId(OTHER);

        assertThrows(AccountNotFoundException.class, () -> engine.mergeIds(ACME, a.getExternalId(), b.getExternalId()));
    }

    @Test
    void deleteCommunity_removesIdsAndAccounts() {
        LinkedAccount account = engine.addLinkedAccount(SLACK, "U1", LinkOptions.none());
        engine.addLinkedAccount(new Scope(OTHER, "slack", null), "U1", LinkOptions.none());

        engine.deleteCommunity(ACME);

        assertThrows(AccountNotFoundException.class, () -> engine.getIdentity(ACME, account.getExternalId()));
        assertThrows(AccountNotFoundException.class, () -> engine.retrieveAccount(ACME, "slack", "U1", null));
        assertEquals(1, engine.accountCount());
    }

    @Test
    void linkQuality_order() {
        assertTrue(LinkQuality.STRONG_CONFIRM.isGreaterThan(LinkQuality.WEAK_CONFIRM));
        assertTrue(LinkQuality.UNCONFIRMED.isGreaterThan(null));
        assertFalse(LinkQuality.UNKNOWN.isGreaterThan(LinkQuality.UNKNOWN));
        assertSame(LinkQuality.WEAK_CONFIRM, LinkQuality.fromValue("confirmed (weak)"));
        assertSame(LinkType.MANUAL_ADMIN, LinkType.fromValue("manual_admin"));
    }

    private void assertExactlyOnePrimary(List<MetagovId> members) {
        long flags = members.stream()
                .map(m -> engine.getIdentity(ACME, m.getExternalId()))
                .filter(MetagovId::getPrimaryFlag)
                .count();
        assertEquals(1, flags);
    }

    private static final class Scope implements PlatformScope {
        private final Community community;
        private final String platformType;
        private final String communityPlatformId;

        Scope(Community community, String platformType, String communityPlatformId) {
            this.community = community;
            this.platformType = platformType;
            this.communityPlatformId = communityPlatformId;
        }

        @Override
        public Community getCommunity() {
            return community;
        }

        @Override
        public String getPlatformType() {
            return platformType;
        }

        @Override
        public String getCommunityPlatformId() {
            return communityPlatformId;
        }
    }
}
