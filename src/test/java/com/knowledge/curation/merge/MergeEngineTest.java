package com.knowledge.curation.merge;

import com.knowledge.curation.audit.DecisionLog;
import com.knowledge.curation.audit.DecisionLogRepository;
import com.knowledge.curation.audit.DecisionPersistenceException;
import com.knowledge.curation.audit.DecisionRecord;
import com.knowledge.curation.audit.InMemoryDecisionLogRepository;
import com.knowledge.curation.cache.EmbeddingChangeListener;
import com.knowledge.curation.core.model.DecisionAction;
import com.knowledge.curation.core.model.DecisionActor;
import com.knowledge.curation.core.model.Item;
import com.knowledge.curation.core.model.ItemStatus;
import com.knowledge.curation.store.InMemoryItemRepository;
import com.knowledge.curation.support.TestItems;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("MergeEngine Tests")
class MergeEngineTest {

    private InMemoryItemRepository items;
    private InMemoryDecisionLogRepository records;
    private MergeEngine engine;

    @BeforeEach
    void setUp() {
        items = new InMemoryItemRepository(List.of(
                TestItems.pending("a", "skill"),
                TestItems.pending("b", "skill"),
                TestItems.pending("c", "skill"),
                TestItems.pending("d", "skill"),
                TestItems.pending("x", "experience")));
        records = new InMemoryDecisionLogRepository();
        engine = new MergeEngine(items, new DecisionLog(records));
    }

    private static DecisionContext auto() {
        return new DecisionContext("run-1", 1, DecisionActor.AUTO_THRESHOLD, null, Map.of(), null);
    }

    private Item item(String id) {
        return items.findById(id).orElseThrow();
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        @DisplayName("Merged items are rejected and point at the canonical")
        void mergesIntoCanonical() {
            MergeResult result = engine.merge(List.of("a", "b", "c"), "a", DecisionAction.MERGE, auto());

            assertTrue(result.isSuccess());
            assertEquals(List.of("b", "c"), result.affectedIds());
            assertEquals(ItemStatus.PENDING, item("a").getStatus());
            assertEquals("a", item("b").getCanonicalOf());
            assertEquals("a", item("c").getCanonicalOf());
            assertEquals(1, records.count());
            assertEquals(DecisionActor.AUTO_THRESHOLD, records.findAll().get(0).actor());
        }

        @Test
        @DisplayName("Canonical chains are flattened to depth one")
        void flattensChains() {
            engine.merge(List.of("a", "b"), "a", DecisionAction.MERGE, auto());

            engine.merge(List.of("a", "c"), "c", DecisionAction.MERGE, auto());

            assertEquals("c", item("a").getCanonicalOf());
            assertEquals("c", item("b").getCanonicalOf());
            assertTrue(items.findAll().stream()
                    .filter(Item::isMerged)
                    .allMatch(i -> item(i.getCanonicalOf()).isActive()));
        }

        @Test
        @DisplayName("Merging an inactive item is a conflict")
        void staleItem() {
            engine.merge(List.of("a", "b"), "a", DecisionAction.MERGE, auto());

            ConcurrentMutationConflictException e = assertThrows(ConcurrentMutationConflictException.class,
                    () -> engine.merge(List.of("b", "c"), "c", DecisionAction.MERGE, auto()));
            assertEquals(List.of("b"), e.getConflictingIds());
            assertEquals(1, records.count());
        }

        @Test
        @DisplayName("Items already mutated in the scope cannot be touched again")
        void scopeConflict() {
            MutationScope scope = new MutationScope("round 1");
            DecisionContext context = new DecisionContext("run-1", 1, DecisionActor.AUTO_THRESHOLD,
                    null, Map.of(), scope);
            engine.merge(List.of("a", "b"), "a", DecisionAction.MERGE, context);

            assertTrue(scope.isTouched("a"));
            assertThrows(ConcurrentMutationConflictException.class,
                    () -> engine.merge(List.of("a", "c"), "a", DecisionAction.MERGE, context));
            assertTrue(item("c").isActive());
        }

        @Test
        @DisplayName("Cross-category merges are refused before anything is recorded")
        void crossCategory() {
            assertThrows(IllegalArgumentException.class,
                    () -> engine.merge(List.of("a", "x"), "a", DecisionAction.MERGE, auto()));
            assertEquals(0, records.count());
        }

        @Test
        @DisplayName("Canonical must be part of the subject")
        void canonicalInSubject() {
            assertThrows(IllegalArgumentException.class,
                    () -> engine.merge(List.of("a", "b"), "c", DecisionAction.MERGE, auto()));
            assertThrows(IllegalArgumentException.class,
                    () -> engine.merge(List.of("a", "b"), "a", DecisionAction.KEEP_SEPARATE, auto()));
        }
    }

    @Nested
    @DisplayName("Write-ahead and failures")
    class WriteAhead {

        @Test
        @DisplayName("A failed decision write leaves every item untouched")
        void persistenceFailure() {
            DecisionLogRepository failing = mock(DecisionLogRepository.class);
            when(failing.append(any())).thenThrow(new DecisionPersistenceException("disk full", new IOException()));
            MergeEngine failingEngine = new MergeEngine(items, new DecisionLog(failing));

            assertThrows(DecisionPersistenceException.class,
                    () -> failingEngine.merge(List.of("a", "b"), "a", DecisionAction.MERGE, auto()));
            assertEquals(5, items.countActive());
        }

        @Test
        @DisplayName("A store failure half way restores earlier mutations")
        void storeFailureCompensates() {
            FailingItemRepository flaky = new FailingItemRepository(items.findAll());
            MergeEngine flakyEngine = new MergeEngine(flaky, new DecisionLog(records));
            flaky.failOn("c");

            MergeResult result = flakyEngine.merge(List.of("a", "b", "c"), "a", DecisionAction.MERGE, auto());

            assertTrue(result.isFailure());
            assertTrue(flaky.findById("b").orElseThrow().isActive());
            assertTrue(flaky.findById("c").orElseThrow().isActive());
            assertEquals(1, records.count(), "the decision record was written ahead");
        }

        @Test
        @DisplayName("Dry run records nothing and mutates nothing")
        void dryRun() {
            MergeEngine dryRunEngine = new MergeEngine(items, new DecisionLog(records, null, true));

            MergeResult result = dryRunEngine.merge(List.of("a", "b"), "a", DecisionAction.MERGE, auto());

            assertTrue(result.dryRun());
            assertEquals(List.of("b"), result.affectedIds());
            assertEquals(0, records.count());
            assertTrue(item("b").isActive());
        }
    }

    @Nested
    @DisplayName("Reject, update and record-only")
    class OtherDecisions {

        @Test
        @DisplayName("Reject marks the item REJECTED without a canonical")
        void reject() {
            engine.reject("d", DecisionContext.human("review-1", "obsolete"));

            assertEquals(ItemStatus.REJECTED, item("d").getStatus());
            assertNull(item("d").getCanonicalOf());
        }

        @Test
        @DisplayName("A canonical with merged dependents cannot be rejected")
        void rejectCanonical() {
            engine.merge(List.of("a", "b"), "a", DecisionAction.MERGE, auto());

            assertThrows(IllegalStateException.class,
                    () -> engine.reject("a", DecisionContext.human("review-1", "obsolete")));
            assertTrue(item("a").isActive());
        }

        @Test
        @DisplayName("Update changes content, marks the embedding stale and notifies listeners")
        void update() {
            EmbeddingChangeListener listener = mock(EmbeddingChangeListener.class);
            engine.addEmbeddingChangeListener(listener);
            long version = item("a").getVersion();

            MergeResult result = engine.update("a", "New title", null, DecisionContext.human("review-1", "typo"));

            assertEquals("New title", item("a").getTitle());
            assertTrue(item("a").isEmbeddingStale());
            assertEquals(version + 1, item("a").getVersion());
            assertEquals("New title", result.record().details().get("title"));
            verify(listener).onEmbeddingChanged("a");
        }

        @Test
        @DisplayName("Record-only decisions do not mutate items")
        void recordOnly() {
            DecisionRecord record = engine.recordOnly(List.of("a", "b"), DecisionAction.KEEP_SEPARATE,
                    DecisionContext.human("review-1", "different tools"));

            assertEquals(DecisionAction.KEEP_SEPARATE, record.action());
            assertEquals(5, items.countActive());
            assertThrows(IllegalArgumentException.class, () -> engine.recordOnly(List.of("a", "b"),
                    DecisionAction.MERGE, DecisionContext.human("review-1", "x")));
        }
    }

    /**
     * Store that fails when saving one chosen item.
     */
    private static class FailingItemRepository extends InMemoryItemRepository {
        private String failingId;

        FailingItemRepository(List<Item> initial) {
            super(initial.stream().map(Item::copy).toList());
        }

        void failOn(String id) {
            this.failingId = id;
        }

        @Override
        public void save(Item item) {
            if (item.getId().equals(failingId) && item.getStatus() == ItemStatus.REJECTED) {
                throw new IllegalStateException("write failed for " + item.getId());
            }
            super.save(item);
        }
    }
}
