package com.knowledge.curation.convergence;

import com.knowledge.curation.audit.DecisionLog;
import com.knowledge.curation.audit.DecisionRecord;
import com.knowledge.curation.audit.InMemoryDecisionLogRepository;
import com.knowledge.curation.community.CommunityDetector;
import com.knowledge.curation.community.CommunityScoring;
import com.knowledge.curation.community.LouvainCommunityDetector;
import com.knowledge.curation.config.CurationOptions;
import com.knowledge.curation.core.model.DecisionAction;
import com.knowledge.curation.core.model.DecisionActor;
import com.knowledge.curation.core.model.Item;
import com.knowledge.curation.core.model.ManualReviewEntry;
import com.knowledge.curation.decision.DecisionPolicyEngine;
import com.knowledge.curation.decision.PolicyMode;
import com.knowledge.curation.drift.DriftTriadDetector;
import com.knowledge.curation.graph.SimilarityGraphBuilder;
import com.knowledge.curation.llm.AdjudicationDecision;
import com.knowledge.curation.llm.AdjudicationResponseParser;
import com.knowledge.curation.llm.AdjudicationService;
import com.knowledge.curation.merge.MergeEngine;
import com.knowledge.curation.store.InMemoryItemRepository;
import com.knowledge.curation.store.InMemorySessionStateRepository;
import com.knowledge.curation.store.SessionState;
import com.knowledge.curation.support.ScoreTableVectorProvider;
import com.knowledge.curation.support.ScriptedLLMAdjudicator;
import com.knowledge.curation.support.TestItems;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConvergenceLoop Tests")
class ConvergenceLoopTest {

    private static final CurationOptions OPTIONS = CurationOptions.builder()
            .llmRetryBackoff(Duration.ZERO)
            .build();

    /**
     * Wires a loop over in-memory stores.
     */
    private static final class Harness {
        final InMemoryItemRepository items;
        final ScoreTableVectorProvider provider;
        final ScriptedLLMAdjudicator adjudicator;
        final InMemoryDecisionLogRepository records = new InMemoryDecisionLogRepository();
        final InMemorySessionStateRepository states = new InMemorySessionStateRepository();
        final ConvergenceLoop loop;

        Harness(List<Item> all, ScriptedLLMAdjudicator adjudicator, CurationOptions options,
                Consumer<ScoreTableVectorProvider> scores) {
            this(all, adjudicator, options, scores, new LouvainCommunityDetector(options.getCommunitySeed(),
                    options.getCommunityResolution(), options.getMaxCommunitySize()));
        }

        Harness(List<Item> all, ScriptedLLMAdjudicator adjudicator, CurationOptions options,
                Consumer<ScoreTableVectorProvider> scores, CommunityDetector detector) {
            this.items = new InMemoryItemRepository(all);
            this.provider = new ScoreTableVectorProvider(items);
            scores.accept(provider);
            this.adjudicator = adjudicator;
            DecisionLog decisionLog = new DecisionLog(records, null, options.isDryRun());
            this.loop = new ConvergenceLoop(
                    new SimilarityGraphBuilder(provider, options),
                    detector,
                    new DriftTriadDetector(options.getHighBucketThreshold()),
                    new DecisionPolicyEngine(options, PolicyMode.AUTOMATED),
                    new AdjudicationService(adjudicator, options),
                    new MergeEngine(items, decisionLog),
                    states,
                    options,
                    null);
        }
    }

    private static List<Item> skills(String... ids) {
        List<Item> all = new ArrayList<>();
        for (String id : ids) {
            all.add(TestItems.pending(id, "skill"));
        }
        return all;
    }

    /**
     * k1/k2 are auto duplicates, k3/k4/k5 a high-similarity cluster, k6 stands alone.
     */
    private static Harness autoAndHighCluster(ScriptedLLMAdjudicator adjudicator, CurationOptions options) {
        return new Harness(skills("k1", "k2", "k3", "k4", "k5", "k6"), adjudicator, options, p -> p
                .score("k1", "k2", 0.99)
                .score("k3", "k4", 0.93)
                .score("k3", "k5", 0.93)
                .score("k4", "k5", 0.93));
    }

    /**
     * The adjudicator merges only the two lowest ids, so the a/b/c cluster needs two rounds.
     */
    private static ScriptedLLMAdjudicator pairAtATime() {
        return new ScriptedLLMAdjudicator(r -> AdjudicationDecision.mergeSubset(
                List.of(r.allowedIds().stream().sorted().limit(2).toList()), "closest pair", 0.9));
    }

    private static Harness slowCluster() {
        return new Harness(skills("a", "b", "c", "x1", "x2", "x3", "x4", "x5"), pairAtATime(), OPTIONS, p -> p
                .score("a", "b", 0.93)
                .score("a", "c", 0.93)
                .score("b", "c", 0.93));
    }

    /**
     * {@code count} skills named k01, k02, ... in id order.
     */
    private static List<Item> numberedSkills(int count) {
        List<Item> all = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            all.add(TestItems.pending(String.format(Locale.ROOT, "k%02d", i), "skill"));
        }
        return all;
    }

    /**
     * Reports the given member lists, reduced to the nodes still in the graph.
     */
    private static CommunityDetector fixedCommunities(List<List<String>> groups) {
        return graph -> groups.stream()
                .filter(g -> g.stream().allMatch(graph::containsNode))
                .map(g -> CommunityScoring.score(graph.category(), g, graph.edgesWithin(g), 50))
                .toList();
    }

    @Nested
    @DisplayName("Improvement rate")
    class ImprovementRate {

        @Test
        @DisplayName("Reduction is measured against the items not sent to manual review")
        void excludesManualItems() {
            assertEquals(0.1, ConvergenceLoop.improvementRate(100, 90, 0), 1e-9);
            assertEquals(2.0 / 6.0, ConvergenceLoop.improvementRate(10, 8, 4), 1e-9);
        }

        @Test
        @DisplayName("Nothing left to improve yields 0.0")
        void zeroDenominator() {
            assertEquals(0.0, ConvergenceLoop.improvementRate(4, 4, 4));
            assertEquals(0.0, ConvergenceLoop.improvementRate(3, 3, 5));
        }
    }

    @Nested
    @DisplayName("Rounds")
    class Rounds {

        @Test
        @DisplayName("Auto-dedup and LLM merges run in the same round, then the loop runs out of candidates")
        void mergesThenStops() {
            Harness h = autoAndHighCluster(ScriptedLLMAdjudicator.alwaysMergeAll(0.95), OPTIONS);

            ConvergenceReport report = h.loop.run("night-1");

            assertEquals(StopReason.NO_CANDIDATES, report.stopReason());
            assertEquals(2, report.roundsRun());
            assertEquals(6, report.initialActive());
            assertEquals(3, report.finalActive());
            assertEquals(3, report.totalMerges());
            assertEquals(1, report.rounds().get(0).autoDedupMerges());
            assertEquals(2, report.rounds().get(0).merges());
            assertEquals(0.5, report.rounds().get(0).improvementRate(), 1e-9);
            assertTrue(report.manualReviewQueue().isEmpty());
            assertEquals("k3", h.items.findById("k5").orElseThrow().getCanonicalOf());
        }

        @Test
        @DisplayName("LLM merges are logged with the adjudicator and its confidence")
        void recordsLlmDecisions() {
            Harness h = autoAndHighCluster(ScriptedLLMAdjudicator.alwaysMergeAll(0.95), OPTIONS);

            h.loop.run("night-1");

            List<DecisionRecord> llm = h.records.findAll().stream()
                    .filter(r -> r.actor() == DecisionActor.LLM)
                    .toList();
            assertEquals(1, llm.size());
            assertEquals(DecisionAction.MERGE, llm.get(0).action());
            assertEquals(List.of("k3", "k4", "k5"), llm.get(0).subject());
            assertEquals("0.950", llm.get(0).details().get("confidence"));
            assertEquals("scripted", llm.get(0).details().get("adjudicator"));
            assertEquals("skill/k3", llm.get(0).details().get("communityId"));
            assertEquals(1, h.records.findAll().stream()
                    .filter(r -> r.actor() == DecisionActor.AUTO_THRESHOLD).count());
        }

        @Test
        @DisplayName("The adjudicator never sees items the auto-dedup pass already merged")
        void adjudicatesRebuiltGraph() {
            Harness h = autoAndHighCluster(ScriptedLLMAdjudicator.alwaysMergeAll(0.95), OPTIONS);

            h.loop.run("night-1");

            assertEquals(1, h.adjudicator.getRequests().size());
            assertEquals(List.of("k3", "k4", "k5"), h.adjudicator.getRequests().get(0).allowedIds());
        }

        @Test
        @DisplayName("A round below the minimum improvement rate converges")
        void convergesOnLowImprovement() {
            Harness h = autoAndHighCluster(ScriptedLLMAdjudicator.alwaysManualReview(), OPTIONS);

            ConvergenceReport report = h.loop.run("night-1");

            // round 1 still merges k1/k2, round 2 only defers the cluster again
            assertEquals(StopReason.CONVERGED, report.stopReason());
            assertEquals(2, report.roundsRun());
            assertEquals(5, report.finalActive());
            assertEquals(2, report.manualReviewQueue().size());
        }

        @Test
        @DisplayName("With no minimum improvement the iteration cap stops the loop")
        void stopsAtIterationCap() {
            CurationOptions options = CurationOptions.builder(OPTIONS)
                    .minImprovementRate(0.0)
                    .maxIterations(3)
                    .build();
            Harness h = new Harness(skills("a", "b"), ScriptedLLMAdjudicator.alwaysManualReview(), options,
                    p -> p.score("a", "b", 0.90));

            ConvergenceReport report = h.loop.run("night-1");

            assertEquals(StopReason.MAX_ITERATIONS, report.stopReason());
            assertEquals(3, report.roundsRun());
            assertEquals(3, report.manualReviewQueue().size());
            ManualReviewEntry entry = report.manualReviewQueue().get(0);
            assertEquals(List.of("a", "b"), entry.members());
            assertEquals("needs a human", entry.reason());
            assertTrue(report.warnings().contains("Stopped at the iteration cap of 3 rounds"));
        }

        @Test
        @DisplayName("Oversized communities go to the manual queue without an LLM call")
        void queuesOversized() {
            CurationOptions options = CurationOptions.builder(OPTIONS).maxCommunitySize(2).build();
            Harness h = autoAndHighCluster(ScriptedLLMAdjudicator.alwaysMergeAll(0.95), options);

            ConvergenceReport report = h.loop.run("night-1");

            assertTrue(h.adjudicator.getRequests().isEmpty());
            assertFalse(report.manualReviewQueue().isEmpty());
            assertEquals("oversized community (3 members)", report.manualReviewQueue().get(0).reason());
            assertEquals(5, report.finalActive());
        }

        @Test
        @DisplayName("Low-confidence LLM answers are deferred, not applied")
        void defersLowConfidence() {
            Harness h = autoAndHighCluster(ScriptedLLMAdjudicator.alwaysMergeAll(0.60), OPTIONS);

            ConvergenceReport report = h.loop.run("night-1");

            assertEquals(5, report.finalActive());
            assertFalse(report.manualReviewQueue().isEmpty());
            assertTrue(report.manualReviewQueue().get(0).reason().startsWith("low confidence 0.60"));
            assertTrue(h.records.findAll().stream().noneMatch(r -> r.actor() == DecisionActor.LLM));
        }

        @Test
        @DisplayName("A canonical kept by auto-dedup is adjudicated in the same round")
        void autoDedupCanonicalStaysAvailable() {
            Harness h = new Harness(numberedSkills(40), ScriptedLLMAdjudicator.alwaysMergeAll(0.95), OPTIONS, p -> p
                    .score("k01", "k02", 0.99)
                    .score("k01", "k03", 0.93)
                    .score("k02", "k03", 0.93));

            ConvergenceReport report = h.loop.run("night-1");

            assertEquals(1, h.adjudicator.getRequests().size());
            assertEquals(List.of("k01", "k03"), h.adjudicator.getRequests().get(0).allowedIds());
            assertEquals("k01", h.items.findById("k03").orElseThrow().getCanonicalOf());
            assertEquals(0, report.rounds().get(0).deferredConflicts());
            assertEquals(38, report.finalActive());
            assertEquals(StopReason.NO_CANDIDATES, report.stopReason());
        }

        @Test
        @DisplayName("A round with deferred decisions is followed by another round")
        void deferredDecisionsGetAnotherRound() {
            List<Item> all = skills("a", "b", "c");
            all.addAll(numberedSkills(27));
            Harness h = new Harness(all, ScriptedLLMAdjudicator.alwaysMergeAll(0.95), OPTIONS, p -> p
                    .score("a", "b", 0.93)
                    .score("a", "c", 0.93)
                    .score("b", "c", 0.93),
                    fixedCommunities(List.of(List.of("a", "b"), List.of("a", "c"), List.of("b", "c"))));

            ConvergenceReport report = h.loop.run("night-1");

            // round 1 improves by 1/30, below the minimum, but two decisions were deferred
            assertEquals(2, report.rounds().get(0).deferredConflicts());
            assertEquals(2, report.roundsRun());
            assertEquals("a", h.items.findById("c").orElseThrow().getCanonicalOf());
            assertEquals(28, report.finalActive());
            assertEquals(StopReason.CONVERGED, report.stopReason());
        }

        @Test
        @DisplayName("A subset merge keeps the item the adjudicator merged into")
        void subsetMergeFollowsAdjudicatorDirection() {
            AdjudicationResponseParser parser = new AdjudicationResponseParser();
            ScriptedLLMAdjudicator adjudicator = new ScriptedLLMAdjudicator(r -> parser.parse(
                    "{\"decision\":\"merge_subset\",\"merges\":[[\"a\",\"b\"]],\"confidence\":0.9,"
                            + "\"notes\":\"b is the complete version\"}", r.allowedIds()));
            Harness h = new Harness(skills("a", "b", "c"), adjudicator, OPTIONS, p -> p
                    .score("a", "b", 0.93)
                    .score("a", "c", 0.93)
                    .score("b", "c", 0.93));

            h.loop.run("night-1");

            assertEquals("b", h.items.findById("a").orElseThrow().getCanonicalOf());
            assertTrue(h.items.findById("b").orElseThrow().isActive());
            DecisionRecord record = h.records.findAll().get(0);
            assertEquals(DecisionAction.MERGE_SUBSET, record.action());
            assertEquals("b", record.canonicalId());
        }

        @Test
        @DisplayName("An empty graph stops immediately")
        void noCandidates() {
            Harness h = new Harness(skills("a", "b"), ScriptedLLMAdjudicator.alwaysMergeAll(0.95), OPTIONS, p -> {
            });

            ConvergenceReport report = h.loop.run("night-1");

            assertEquals(StopReason.NO_CANDIDATES, report.stopReason());
            assertEquals(1, report.roundsRun());
            assertEquals(0, report.reduction());
        }
    }

    @Nested
    @DisplayName("Checkpoints")
    class Checkpoints {

        @Test
        @DisplayName("Each completed round is checkpointed and the session is marked complete")
        void checkpointsRounds() {
            Harness h = slowCluster();

            ConvergenceReport report = h.loop.run("night-1");

            SessionState state = h.states.load("night-1").orElseThrow();
            assertTrue(state.completed());
            assertEquals(3, state.roundCounter());
            assertEquals(report.rounds(), state.rounds());
            assertEquals(StopReason.NO_CANDIDATES, report.stopReason());
            assertEquals(6, report.finalActive());
        }

        @Test
        @DisplayName("A provider failure keeps the checkpoint at the last completed round")
        void providerFailure() {
            Harness h = slowCluster();
            // round 1 queries each of the 8 items once
            h.provider.failAfter(8);

            ConvergenceReport report = h.loop.run("night-1");

            assertEquals(StopReason.PROVIDER_FAILURE, report.stopReason());
            assertEquals(1, report.roundsRun());
            assertTrue(report.warnings().get(0).startsWith("Round 2 failed"));
            SessionState state = h.states.load("night-1").orElseThrow();
            assertFalse(state.completed());
            assertEquals(1, state.roundCounter());
        }

        @Test
        @DisplayName("A resumed run ends exactly where an uninterrupted run does")
        void resumeMatchesUninterrupted() {
            Harness uninterrupted = slowCluster();
            ConvergenceReport expected = uninterrupted.loop.run("night-1");

            Harness interrupted = slowCluster();
            interrupted.provider.failAfter(8);
            interrupted.loop.run("night-1");
            interrupted.provider.recover();
            ConvergenceReport resumed = interrupted.loop.run("night-1");

            assertEquals(expected.stopReason(), resumed.stopReason());
            assertEquals(expected.finalActive(), resumed.finalActive());
            assertEquals(expected.initialActive(), resumed.initialActive());
            assertEquals(expected.rounds(), resumed.rounds());
            assertEquals(uninterrupted.records.count(), interrupted.records.count());
            assertEquals(2, interrupted.adjudicator.getRequests().size());
        }

        @Test
        @DisplayName("Running a completed session again changes nothing")
        void completedSessionIsNoOp() {
            Harness h = slowCluster();
            ConvergenceReport first = h.loop.run("night-1");
            int requests = h.adjudicator.getRequests().size();

            ConvergenceReport second = h.loop.run("night-1");

            assertEquals(first.rounds(), second.rounds());
            assertEquals(first.stopReason(), second.stopReason());
            assertEquals(requests, h.adjudicator.getRequests().size());
        }
    }

    @Nested
    @DisplayName("Dry run")
    class DryRun {

        @Test
        @DisplayName("Computes one preview round and persists nothing")
        void previewsOneRound() {
            CurationOptions options = CurationOptions.builder(OPTIONS).dryRun(true).build();
            Harness h = autoAndHighCluster(ScriptedLLMAdjudicator.alwaysMergeAll(0.95), options);

            ConvergenceReport report = h.loop.run("night-1");

            assertEquals(StopReason.DRY_RUN_PREVIEW, report.stopReason());
            assertTrue(report.dryRun());
            assertEquals(1, report.roundsRun());
            assertEquals(6, report.finalActive());
            assertEquals(0, h.records.count());
            assertTrue(h.states.load("night-1").isEmpty());
            assertTrue(report.warnings().contains("Dry run: no decisions or item changes were persisted"));
        }
    }
}
