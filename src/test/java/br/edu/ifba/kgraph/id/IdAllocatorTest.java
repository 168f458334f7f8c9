package br.edu.ifba.kgraph.id;

import br.edu.ifba.kgraph.IngestionFixtures;
import br.edu.ifba.kgraph.exception.AllocatorExhaustedException;
import br.edu.ifba.kgraph.exception.ErrorCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for IdAllocator in both allocation modes.
 */
class IdAllocatorTest {

    // ==========================================================================
    // Wall-clock mode
    // ==========================================================================

    @Test
    @DisplayName("Counter should restart when the millisecond advances")
    void testCounterResetsOnNewMillisecond() {
        MutableClock clock = new MutableClock(1_000L);
        IdAllocator allocator = IdAllocator.wallClock(clock, 12, 999_999);

        ParsedId a = ParsedId.parse(allocator.segmentId("doc", 0));
        ParsedId b = ParsedId.parse(allocator.segmentId("doc", 1));
        clock.set(1_001L);
        ParsedId c = ParsedId.parse(allocator.segmentId("doc", 2));

        assertEquals(1_000L, a.timestamp());
        assertEquals(0L, a.counter());
        assertEquals(1L, b.counter());
        assertEquals(1_001L, c.timestamp());
        assertEquals(0L, c.counter());
        assertEquals(3L, allocator.issued());
    }

    @Test
    @DisplayName("A clock moving backwards should not produce an earlier timestamp")
    void testBackwardsClockIsClamped() {
        MutableClock clock = new MutableClock(5_000L);
        IdAllocator allocator = IdAllocator.wallClock(clock, 12, 999_999);

        ParsedId before = ParsedId.parse(allocator.segmentId("doc", 0));
        clock.set(4_000L);
        ParsedId after = ParsedId.parse(allocator.segmentId("doc", 0));

        assertEquals(5_000L, after.timestamp());
        assertEquals(1L, after.counter());
        assertNotEquals(before.format(), after.format());
        assertTrue(ParsedId.CREATION_ORDER.compare(before, after) < 0);
    }

    @Test
    @DisplayName("Should fail loudly when a millisecond runs out of counter values")
    void testExhaustion() {
        IdAllocator allocator = IdAllocator.wallClock(IngestionFixtures.fixedClock(), 12, 3);

        allocator.segmentId("doc", 0);
        allocator.segmentId("doc", 1);
        allocator.segmentId("doc", 2);

        AllocatorExhaustedException e = assertThrows(AllocatorExhaustedException.class,
            () -> allocator.segmentId("doc", 3));
        assertEquals(ErrorCategory.ALLOCATOR, e.getCategory());
        assertEquals(3L, allocator.issued());
    }

    @Test
    @DisplayName("Concurrent callers sharing one allocator should never receive the same identifier")
    void testConcurrentAllocationIsUnique() throws Exception {
        IdAllocator allocator = IdAllocator.wallClock(IngestionFixtures.fixedClock(), 12, 999_999);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            @SuppressWarnings("unchecked")
            CompletableFuture<Set<String>>[] futures = new CompletableFuture[4];
            for (int t = 0; t < futures.length; t++) {
                futures[t] = CompletableFuture.supplyAsync(() -> {
                    Set<String> ids = new HashSet<>();
                    for (int i = 0; i < 500; i++) {
                        ids.add(allocator.segmentId("same-parent", 0));
                    }
                    return ids;
                }, executor);
            }
            CompletableFuture.allOf(futures).join();

            Set<String> all = new HashSet<>();
            for (CompletableFuture<Set<String>> future : futures) {
                all.addAll(future.get());
            }
            assertEquals(2_000, all.size());
        } finally {
            executor.shutdown();
        }
    }

    // ==========================================================================
    // Deterministic mode
    // ==========================================================================

    @Test
    @DisplayName("Same calls on fresh deterministic allocators should reproduce identifiers")
    void testDeterministicReproducible() {
        IdAllocator first = IdAllocator.deterministic(42L, 12);
        IdAllocator second = IdAllocator.deterministic(42L, 12);

        String doc1 = first.documentId("Title", "/a.txt", "fp");
        String doc2 = second.documentId("Title", "/a.txt", "fp");
        assertEquals(doc1, doc2);
        assertEquals(first.segmentId(doc1, 0), second.segmentId(doc2, 0));
        assertEquals(first.entityId("s", "concept", 0), second.entityId("s", "concept", 0));

        ParsedId parsed = ParsedId.parse(doc1);
        assertEquals(42L, parsed.timestamp());
        assertEquals(0L, parsed.counter());
        assertEquals(IdKind.DOCUMENT, parsed.kind());
    }

    @Test
    @DisplayName("Deterministic document identifiers should depend on the fingerprint")
    void testDeterministicFingerprintInContext() {
        String a = IdAllocator.deterministic(0L, 12).documentId("Title", "/a.txt", "fp-one");
        String b = IdAllocator.deterministic(0L, 12).documentId("Title", "/a.txt", "fp-two");

        assertNotEquals(ParsedId.parse(a).prefix(), ParsedId.parse(b).prefix());
    }

    @Test
    @DisplayName("Different seeds should produce different identifiers")
    void testDifferentSeeds() {
        String a = IdAllocator.deterministic(1L, 12).documentId("Title", null, "fp");
        String b = IdAllocator.deterministic(2L, 12).documentId("Title", null, "fp");

        assertNotEquals(a, b);
        assertEquals(ParsedId.parse(a).prefix(), ParsedId.parse(b).prefix());
    }

    @Test
    @DisplayName("Should reject a negative seed")
    void testNegativeSeed() {
        assertThrows(IllegalArgumentException.class, () -> IdAllocator.deterministic(-1L, 12));
    }

    // ==========================================================================
    // Identifier shape
    // ==========================================================================

    @Test
    @DisplayName("Entity identifiers should carry kind, local index and type tag")
    void testEntityIdShape() {
        IdAllocator allocator = IdAllocator.deterministic(0L, 12);

        ParsedId id = ParsedId.parse(allocator.entityId("sentence-1", "Person", 7));

        assertEquals(IdKind.ENTITY, id.kind());
        assertEquals(7, id.localIndex());
        assertEquals("per", id.typeTag());
        assertEquals(12, id.prefix().length());
    }

    @Test
    @DisplayName("Type tag should keep the first three letters or digits")
    void testTypeTag() {
        assertEquals("con", IdAllocator.typeTag("concept"));
        assertEquals("per", IdAllocator.typeTag("Person"));
        assertEquals("ab", IdAllocator.typeTag("a-b"));
        assertEquals("unk", IdAllocator.typeTag(""));
        assertEquals("unk", IdAllocator.typeTag("日本"));
    }

    @Test
    @DisplayName("Prefix should be stable per context with alternating letter case")
    void testContextPrefix() {
        String prefix = ContextPrefix.of("segment_doc_0", 12);

        assertEquals(prefix, ContextPrefix.of("segment_doc_0", 12));
        assertNotEquals(prefix, ContextPrefix.of("segment_doc_1", 12));
        assertEquals(12, prefix.length());
        for (int i = 0; i < prefix.length(); i++) {
            char c = prefix.charAt(i);
            if (Character.isLetter(c)) {
                assertEquals(i % 2 == 0, Character.isUpperCase(c), "unexpected case at " + i + " in " + prefix);
            }
        }
        assertThrows(IllegalArgumentException.class, () -> ContextPrefix.of("x", 0));
    }

    // ==========================================================================
    // Factory scopes
    // ==========================================================================

    @Test
    @DisplayName("Wall-clock scope should share one allocator across documents")
    void testWallClockScopeShared() {
        IdAllocatorFactory factory = new IdAllocatorFactory(IngestionFixtures.config(), IngestionFixtures.fixedClock());

        Supplier<IdAllocator> scope = factory.batchScope();

        assertSame(scope.get(), scope.get());
        assertEquals(AllocationMode.WALL_CLOCK, scope.get().getMode());
    }

    @Test
    @DisplayName("Deterministic scope should hand out a fresh allocator per document")
    void testDeterministicScopeFresh() {
        IdAllocatorFactory factory = new IdAllocatorFactory(
            IngestionFixtures.config(Map.of("kgraph.id.mode", "deterministic")), IngestionFixtures.fixedClock());

        Supplier<IdAllocator> scope = factory.batchScope();
        IdAllocator first = scope.get();

        assertNotSame(first, scope.get());
        assertEquals(AllocationMode.DETERMINISTIC, first.getMode());
    }

    /**
     * Clock whose instant is set by the test.
     */
    static final class MutableClock extends Clock {

        private long millis;

        MutableClock(long millis) {
            this.millis = millis;
        }

        void set(long millis) {
            this.millis = millis;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }
    }
}
