package com.knowledge.curation.review;

import com.knowledge.curation.audit.DecisionLog;
import com.knowledge.curation.audit.DecisionLogRepository;
import com.knowledge.curation.audit.DecisionPersistenceException;
import com.knowledge.curation.audit.DecisionRecord;
import com.knowledge.curation.audit.InMemoryDecisionLogRepository;
import com.knowledge.curation.core.model.DecisionAction;
import com.knowledge.curation.core.model.DecisionActor;
import com.knowledge.curation.core.model.Item;
import com.knowledge.curation.core.model.ItemStatus;
import com.knowledge.curation.core.model.ReviewEntryKind;
import com.knowledge.curation.core.model.ReviewQueueEntry;
import com.knowledge.curation.decision.Bucket;
import com.knowledge.curation.merge.MergeEngine;
import com.knowledge.curation.store.InMemoryItemRepository;
import com.knowledge.curation.store.InMemorySessionStateRepository;
import com.knowledge.curation.support.TestItems;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("ReviewSession Tests")
class ReviewSessionTest {

    private InMemoryItemRepository items;
    private InMemoryDecisionLogRepository records;
    private InMemorySessionStateRepository sessions;
    private MergeEngine mergeEngine;

    private static final ReviewQueueEntry TRIAD = new ReviewQueueEntry("triad:a,b,c", ReviewEntryKind.TRIAD,
            "skill", List.of("a", "b", "c"), 0.87,
            Map.of("a|b", 0.88, "b|c", 0.87, "a|c", 0.65), "merge a+b, keep c separate");
    private static final ReviewQueueEntry PAIR = new ReviewQueueEntry("skill/d", ReviewEntryKind.PAIR,
            "skill", List.of("d", "e"), 0.93, Map.of("d|e", 0.93), null);
    private static final ReviewQueueEntry GROUP = new ReviewQueueEntry("skill/f", ReviewEntryKind.COMMUNITY,
            "skill", List.of("f", "g", "h"), 0.9, Map.of("f|g", 0.95, "g|h", 0.85), null);

    @BeforeEach
    void setUp() {
        items = new InMemoryItemRepository();
        for (String id : List.of("a", "b", "c", "d", "e", "f", "g", "h")) {
            items.save(TestItems.pending(id, "skill"));
        }
        records = new InMemoryDecisionLogRepository();
        sessions = new InMemorySessionStateRepository();
        mergeEngine = new MergeEngine(items, new DecisionLog(records));
    }

    private ReviewSession start(ReviewQueueEntry... queue) {
        return ReviewSession.start("review-1", "skill", Bucket.HIGH, List.of(queue), mergeEngine, sessions);
    }

    private Item item(String id) {
        return items.findById(id).orElseThrow();
    }

    @Nested
    @DisplayName("Drift triads")
    class Triads {

        @Test
        @DisplayName("merge_ab merges A and B only and leaves C untouched")
        void mergeAB() {
            ReviewSession session = start(TRIAD, PAIR);

            ReviewOutcome outcome = session.handle("merge_ab");

            assertTrue(outcome.success());
            DecisionRecord record = outcome.record();
            assertEquals(DecisionAction.MERGE, record.action());
            assertEquals(DecisionActor.HUMAN, record.actor());
            assertEquals(List.of("a", "b"), record.subject());
            assertEquals("a", record.canonicalId());
            assertEquals("b", item("b").getCanonicalOf());
            assertTrue(item("c").isActive());
            assertEquals(1, records.count());
            assertEquals("skill/d", session.currentEntry().orElseThrow().id());
        }

        @Test
        @DisplayName("merge_bc honours an explicit canonical")
        void mergeBC() {
            ReviewSession session = start(TRIAD);

            session.handle("merge_bc c");

            assertEquals("c", item("b").getCanonicalOf());
            assertTrue(item("a").isActive());
            assertTrue(session.isFinished());
        }

        @Test
        @DisplayName("Triad members are presented in A, B, C order")
        void presentationOrder() {
            ReviewSession session = start(TRIAD);

            assertEquals(List.of("a", "b", "c"),
                    session.presentedItems().stream().map(Item::getId).toList());
            assertTrue(session.renderCurrent().contains("merge a+b, keep c separate"));
        }

        @Test
        @DisplayName("Triad commands are refused on other entries")
        void triadCommandOnPair() {
            ReviewSession session = start(PAIR);

            ReviewOutcome outcome = session.handle("merge_ab");

            assertFalse(outcome.success());
            assertEquals(0, records.count());
            assertEquals("skill/d", session.currentEntry().orElseThrow().id());
        }

        @Test
        @DisplayName("Triad rationales and errors do not depend on the default locale")
        void localeIndependentText() {
            Locale previous = Locale.getDefault();
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            try {
                ReviewOutcome refused = start(PAIR).handle("merge_bc");
                assertEquals("merge_bc only applies to triads", refused.message());

                ReviewOutcome merged = start(TRIAD).handle("merge_ab");
                assertEquals("triad merge_ab by reviewer", merged.record().rationale());
            } finally {
                Locale.setDefault(previous);
            }
        }
    }

    @Nested
    @DisplayName("Commands")
    class Commands {

        @Test
        @DisplayName("merge folds every shown item into the first one by default")
        void mergeDefaultCanonical() {
            ReviewSession session = start(GROUP);

            session.handle("merge -- same checklist");

            assertTrue(item("f").isActive());
            assertEquals("f", item("g").getCanonicalOf());
            assertEquals("f", item("h").getCanonicalOf());
            assertEquals("same checklist", records.findAll().get(0).rationale());
        }

        @Test
        @DisplayName("keep records KEEP_SEPARATE and moves on")
        void keep() {
            ReviewSession session = start(PAIR, GROUP);

            ReviewOutcome outcome = session.handle("keep");

            assertEquals(DecisionAction.KEEP_SEPARATE, outcome.record().action());
            assertEquals(8, items.countActive());
            assertEquals("skill/f", session.currentEntry().orElseThrow().id());
        }

        @Test
        @DisplayName("update stays on the entry")
        void update() {
            ReviewSession session = start(PAIR);

            session.handle("update d title=Pin the JDK version");

            assertEquals("Pin the JDK version", item("d").getTitle());
            assertEquals("skill/d", session.currentEntry().orElseThrow().id());
        }

        @Test
        @DisplayName("reject with a reason removes the item; the exhausted entry is skipped")
        void reject() {
            ReviewSession session = start(PAIR, GROUP);

            session.handle("reject d obsolete");

            assertEquals(ItemStatus.REJECTED, item("d").getStatus());
            assertEquals("skill/f", session.currentEntry().orElseThrow().id());
        }

        @Test
        @DisplayName("split records the groups and queues the multi-item groups next")
        void split() {
            ReviewSession session = start(GROUP, PAIR);

            ReviewOutcome outcome = session.handle("split f,g | h");

            assertEquals(DecisionAction.SPLIT, outcome.record().action());
            assertEquals("f,g | h", outcome.record().details().get("groups"));
            ReviewQueueEntry next = session.currentEntry().orElseThrow();
            assertEquals("skill/f/split-1", next.id());
            assertEquals(ReviewEntryKind.PAIR, next.kind());
            assertEquals(List.of("f", "g"), next.members());
            assertEquals(0.95, next.score(), 1e-9);
            assertEquals(3, session.getSessionState().queue().size());
        }

        @Test
        @DisplayName("Merging into an item outside the entry is refused")
        void foreignTarget() {
            ReviewSession session = start(PAIR);

            ReviewOutcome outcome = session.handle("merge a");

            assertFalse(outcome.success());
            assertEquals(ReviewState.AWAITING_INPUT, outcome.state());
            assertTrue(item("a").isActive());
        }

        @Test
        @DisplayName("diff and help do not record anything")
        void readOnly() {
            ReviewSession session = start(PAIR);

            assertTrue(session.handle("diff").message().contains("--- d"));
            assertEquals(ReviewCommandParser.HELP_TEXT, session.handle("help").message());
            assertEquals(0, records.count());
        }
    }

    @Nested
    @DisplayName("Persistence")
    class Persistence {

        @Test
        @DisplayName("quit suspends and resume continues at the saved entry")
        void quitAndResume() {
            ReviewSession session = start(TRIAD, PAIR, GROUP);
            session.handle("keep");

            ReviewOutcome quit = session.handle("quit");

            assertEquals(ReviewState.SUSPENDED, quit.state());
            assertEquals("Saved at entry 2 of 3", quit.message());
            assertFalse(session.handle("keep").success());

            ReviewSession resumed = ReviewSession.resume("review-1", mergeEngine, sessions);
            assertEquals("skill/d", resumed.currentEntry().orElseThrow().id());
            assertEquals(1, records.count());
        }

        @Test
        @DisplayName("Entries whose items were merged elsewhere are skipped on resume")
        void skipsExhaustedOnResume() {
            ReviewSession session = start(PAIR, GROUP);
            session.handle("quit");
            item("d").markMergedInto("e");

            ReviewSession resumed = ReviewSession.resume("review-1", mergeEngine, sessions);

            assertEquals("skill/f", resumed.currentEntry().orElseThrow().id());
        }

        @Test
        @DisplayName("Resuming an unknown session fails")
        void unknownSession() {
            assertThrows(IllegalArgumentException.class,
                    () -> ReviewSession.resume("missing", mergeEngine, sessions));
        }

        @Test
        @DisplayName("A failed decision write changes nothing and keeps the cursor")
        void persistenceFailure() {
            DecisionLogRepository failing = mock(DecisionLogRepository.class);
            when(failing.append(any())).thenThrow(new DecisionPersistenceException("disk full", new IOException()));
            MergeEngine failingEngine = new MergeEngine(items, new DecisionLog(failing));
            ReviewSession session = ReviewSession.start("review-2", "skill", Bucket.HIGH, List.of(PAIR),
                    failingEngine, sessions);

            ReviewOutcome outcome = session.handle("merge");

            assertFalse(outcome.success());
            assertTrue(outcome.message().startsWith("Decision could not be recorded"));
            assertTrue(item("e").isActive());
            assertEquals(0, sessions.load("review-2").orElseThrow().cursor());
        }

        @Test
        @DisplayName("Dry-run sessions neither mutate items nor save state")
        void dryRun() {
            MergeEngine dryRunEngine = new MergeEngine(items, new DecisionLog(records, null, true));
            ReviewSession session = ReviewSession.start("review-3", "skill", Bucket.HIGH, List.of(PAIR),
                    dryRunEngine, sessions);

            session.handle("merge");

            assertTrue(item("e").isActive());
            assertEquals(0, records.count());
            assertTrue(sessions.load("review-3").isEmpty());
        }
    }
}
