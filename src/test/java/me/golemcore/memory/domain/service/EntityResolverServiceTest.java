package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.exception.StorageUnavailableException;
import me.golemcore.memory.domain.exception.ValidationException;
import me.golemcore.memory.domain.model.Entity;
import me.golemcore.memory.domain.model.EntityRelationship;
import me.golemcore.memory.domain.model.EntityTypes;
import me.golemcore.memory.port.outbound.StoragePort;
import me.golemcore.memory.testsupport.MemoryTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

class EntityResolverServiceTest {

    private static final String USER = "alice";
    private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");

    @TempDir
    Path tempDir;

    private MemoryTestFixture fixture;
    private EntityResolverService resolver;

    @BeforeEach
    void setUp() {
        fixture = new MemoryTestFixture(tempDir, NOW);
        resolver = fixture.getEntityResolver();
    }

    // ==================== resolve ====================

    @Test
    void shouldCreateTypedEntityFromContext() {
        Entity apple = resolver.resolve(USER, "苹果", "我今天吃了一个苹果", NOW);

        assertEquals("苹果", apple.getCanonicalName());
        assertEquals(EntityTypes.FOOD, apple.getEntityType());
        assertEquals(1, apple.getMentionCount());
        assertEquals(NOW, apple.getFirstSeen());
        assertEquals(NOW, apple.getLastSeen());
    }

    @Test
    void shouldReuseEntityForRepeatedMention() {
        Entity first = resolver.resolve(USER, "苹果", "我今天吃了一个苹果", NOW);
        double initialConfidence = first.getTypeConfidence();

        Entity second = resolver.resolve(USER, "苹果", "又吃了一个苹果", NOW.plus(Duration.ofHours(3)));

        assertEquals(first.getEntityId(), second.getEntityId());
        assertEquals(2, second.getMentionCount());
        assertTrue(second.getTypeConfidence() > initialConfidence);
        assertEquals(NOW.plus(Duration.ofHours(3)), second.getLastSeen());
        assertEquals(1, resolver.getEntities(USER).size());
    }

    @Test
    void shouldReturnSameEntityForIdenticalMentionAndContext() {
        Entity first = resolver.resolve(USER, "苹果", "我今天吃了一个苹果", NOW);
        Entity second = resolver.resolve(USER, "苹果", "我今天吃了一个苹果", NOW.plusSeconds(30));

        assertEquals(first.getEntityId(), second.getEntityId());
        assertEquals(2, resolver.findById(USER, first.getEntityId()).orElseThrow().getMentionCount());
        assertEquals(1, resolver.getEntities(USER).size());
    }

    @Test
    void shouldReturnSameSplitEntityForRepeatedCompanyMention() {
        Entity fruit = resolver.resolve(USER, "苹果", "我今天吃了一个苹果", NOW);
        Entity company = resolver.resolve(USER, "苹果", "苹果公司的股票涨了", NOW.plusSeconds(60));
        Entity again = resolver.resolve(USER, "苹果", "苹果公司的股票涨了", NOW.plusSeconds(120));

        assertEquals(company.getEntityId(), again.getEntityId());
        assertEquals(2, resolver.findById(USER, company.getEntityId()).orElseThrow().getMentionCount());
        assertEquals(1, resolver.findById(USER, fruit.getEntityId()).orElseThrow().getMentionCount());
        assertEquals(2, resolver.getEntities(USER).size());
    }

    @Test
    void shouldSplitSameNameWithDisagreeingContext() {
        Entity fruit = resolver.resolve(USER, "苹果", "我今天吃了一个苹果", NOW);
        Entity company = resolver.resolve(USER, "苹果", "苹果公司的股票涨了", NOW.plusSeconds(60));

        assertNotEquals(fruit.getEntityId(), company.getEntityId());
        assertEquals(EntityTypes.ORGANIZATION, company.getEntityType());
        assertEquals("苹果 (organization)", company.getCanonicalName());
        assertEquals(2, resolver.getEntities(USER).size());
    }

    @Test
    void shouldMatchFuzzyAsciiNames() {
        Entity first = resolver.resolve(USER, "starbucks", null, NOW);
        Entity second = resolver.resolve(USER, "Starbuck", null, NOW.plusSeconds(5));

        assertEquals("Starbucks", first.getCanonicalName());
        assertEquals(first.getEntityId(), second.getEntityId());
        assertEquals(2, second.getMentionCount());
    }

    @Test
    void shouldRejectBlankMention() {
        assertThrows(ValidationException.class, () -> resolver.resolve(USER, "   ", "context", NOW));
        assertThrows(ValidationException.class, () -> resolver.resolve(USER, "苹果", "context", null));
        assertTrue(resolver.getEntities(USER).isEmpty());
    }

    @Test
    void shouldKeepEntitiesPerUser() {
        resolver.resolve(USER, "苹果", "吃苹果", NOW);

        assertTrue(resolver.getEntities("bob").isEmpty());
        assertTrue(resolver.findByCanonicalName(USER, "苹果").isPresent());
    }

    @Test
    void shouldReloadEntitiesFromStorage() {
        Entity apple = resolver.resolve(USER, "苹果", "我今天吃了一个苹果", NOW);

        EntityResolverService reloaded = new EntityResolverService(fixture.getStorage(),
                fixture.getStorageRetry(), fixture.getCodec(), fixture.getValidator(), new ContextClassifier(),
                new EntityAttributeExtractor(), fixture.getProperties());

        Entity restored = reloaded.findById(USER, apple.getEntityId()).orElseThrow();
        assertEquals("苹果", restored.getCanonicalName());
        assertEquals(EntityTypes.FOOD, restored.getEntityType());
    }

    // ==================== attributes ====================

    @Test
    void shouldExtractAttributesFromContext() {
        Entity apple = resolver.resolve(USER, "苹果", "红色的苹果很甜", NOW);

        assertEquals("红色", apple.getAttributes().get("color").getValue());
        assertEquals("甜", apple.getAttributes().get("taste").getValue());
        assertEquals("水果", apple.getAttributes().get("category").getValue());
        assertTrue(apple.getAttributes().get("color").getConfidence() > 0.0);
    }

    @Test
    void shouldReinforceConsistentAttribute() {
        resolver.resolve(USER, "苹果", "红色的苹果", NOW);
        Entity apple = resolver.resolve(USER, "苹果", "又是红色的苹果", NOW.plusSeconds(60));

        assertEquals("红色", apple.getAttributes().get("color").getValue());
        assertEquals(2, apple.getAttributes().get("color").getSupportCount());
        assertEquals(2, apple.getAttributes().get("color").getObservationCount());
    }

    // ==================== decay ====================

    @Test
    void shouldDecayIdleEntitiesOnce() {
        resolver.resolve(USER, "苹果", "我今天吃了一个苹果", NOW);
        double before = resolver.getEntities(USER).get(0).getTypeConfidence();
        Instant later = NOW.plus(Duration.ofDays(40));

        assertEquals(1, resolver.decay(USER, later));
        double after = resolver.getEntities(USER).get(0).getTypeConfidence();
        assertEquals(before * Math.exp(-40.0 / 90.0), after, 1e-9);

        assertEquals(0, resolver.decay(USER, later));
        assertEquals(after, resolver.getEntities(USER).get(0).getTypeConfidence(), 1e-12);
        assertEquals(1, resolver.getEntities(USER).size());
    }

    @Test
    void shouldNotDecayRecentlySeenEntities() {
        resolver.resolve(USER, "苹果", "我今天吃了一个苹果", NOW);

        assertEquals(0, resolver.decay(USER, NOW.plus(Duration.ofDays(10))));
    }

    // ==================== relations ====================

    @Test
    void shouldStrengthenCoOccurrenceEdges() {
        EntityRelationService relations = fixture.getRelationService();

        assertEquals(3, relations.recordCoOccurrence(USER, List.of("e1", "e2", "e3"), NOW));
        assertEquals(1, relations.recordCoOccurrence(USER, List.of("e2", "e1", "e1"), NOW));
        assertEquals(0, relations.recordCoOccurrence(USER, List.of("e1"), NOW));

        List<EntityRelationship> related = relations.findRelated(USER, "e1", 0.0, NOW);
        assertEquals(2, related.size());
        EntityRelationship strongest = related.get(0);
        assertEquals("e2", strongest.otherEnd("e1"));
        assertEquals(2, strongest.getCoOccurrenceCount());
        assertEquals(1.0 - Math.exp(-2.0 / 5.0), strongest.getStrength(), 1e-9);
    }

    @Test
    void shouldWeakenEdgesWithTime() {
        EntityRelationService relations = fixture.getRelationService();
        relations.recordCoOccurrence(USER, List.of("e1", "e2"), NOW);

        double fresh = relations.getRelations(USER, NOW).get(0).getStrength();
        double stale = relations.getRelations(USER, NOW.plus(Duration.ofDays(90))).get(0).getStrength();

        assertEquals(fresh * Math.exp(-1.0), stale, 1e-9);
    }

    // ==================== failed writes ====================

    private EntityResolverService resolverOver(StoragePort storage) {
        return new EntityResolverService(storage, fixture.getStorageRetry(), fixture.getCodec(),
                fixture.getValidator(), new ContextClassifier(), new EntityAttributeExtractor(),
                fixture.getProperties());
    }

    private StoragePort failingWhen(AtomicBoolean failing) {
        StoragePort storage = spy(fixture.getStorage());
        doAnswer(invocation -> failing.get()
                ? CompletableFuture.failedFuture(new IOException("disk full"))
                : invocation.callRealMethod())
                .when(storage).putTextAtomic(eq("entities"), anyString(), anyString(), anyBoolean());
        return storage;
    }

    @Test
    void shouldNotCountMentionWhenWriteFails() {
        AtomicBoolean failing = new AtomicBoolean(false);
        EntityResolverService flaky = resolverOver(failingWhen(failing));
        Entity apple = flaky.resolve(USER, "苹果", "我今天吃了一个苹果", NOW);

        failing.set(true);
        assertThrows(StorageUnavailableException.class,
                () -> flaky.resolve(USER, "苹果", "我今天吃了一个苹果", NOW.plusSeconds(10)));
        assertThrows(StorageUnavailableException.class,
                () -> flaky.resolve(USER, "香蕉", "吃了香蕉", NOW.plusSeconds(20)));

        assertEquals(1, flaky.findById(USER, apple.getEntityId()).orElseThrow().getMentionCount());
        assertEquals(1, flaky.getEntities(USER).size());

        failing.set(false);
        Entity retried = flaky.resolve(USER, "苹果", "我今天吃了一个苹果", NOW.plusSeconds(30));
        assertEquals(apple.getEntityId(), retried.getEntityId());
        assertEquals(2, retried.getMentionCount());
    }

    @Test
    void shouldNotDecayWhenWriteFails() {
        AtomicBoolean failing = new AtomicBoolean(false);
        EntityResolverService flaky = resolverOver(failingWhen(failing));
        Entity apple = flaky.resolve(USER, "苹果", "我今天吃了一个苹果", NOW);
        double confidence = apple.getTypeConfidence();
        Instant later = NOW.plus(Duration.ofDays(40));

        failing.set(true);
        assertThrows(StorageUnavailableException.class, () -> flaky.decay(USER, later));

        Entity unchanged = flaky.findById(USER, apple.getEntityId()).orElseThrow();
        assertEquals(confidence, unchanged.getTypeConfidence(), 1e-12);
        assertNull(unchanged.getLastDecayedAt());

        failing.set(false);
        assertEquals(1, flaky.decay(USER, later));
    }
}
