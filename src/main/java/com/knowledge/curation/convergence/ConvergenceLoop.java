package com.knowledge.curation.convergence;

import com.knowledge.curation.community.CommunityDetector;
import com.knowledge.curation.config.CurationOptions;
import com.knowledge.curation.core.model.Community;
import com.knowledge.curation.core.model.DecisionAction;
import com.knowledge.curation.core.model.DecisionActor;
import com.knowledge.curation.core.model.Item;
import com.knowledge.curation.core.model.ManualReviewEntry;
import com.knowledge.curation.core.model.RoundSummary;
import com.knowledge.curation.decision.DecisionPolicyEngine;
import com.knowledge.curation.decision.RoutingDecision;
import com.knowledge.curation.drift.DriftTriad;
import com.knowledge.curation.drift.DriftTriadDetector;
import com.knowledge.curation.graph.GraphSnapshot;
import com.knowledge.curation.graph.SimilarityGraphBuilder;
import com.knowledge.curation.llm.AdjudicationDecision;
import com.knowledge.curation.llm.AdjudicationRequest;
import com.knowledge.curation.llm.AdjudicationService;
import com.knowledge.curation.logging.LogContext;
import com.knowledge.curation.merge.CanonicalSelector;
import com.knowledge.curation.merge.ConcurrentMutationConflictException;
import com.knowledge.curation.merge.DecisionContext;
import com.knowledge.curation.merge.MergeEngine;
import com.knowledge.curation.merge.MergeResult;
import com.knowledge.curation.merge.MutationScope;
import com.knowledge.curation.metrics.MetricsService;
import com.knowledge.curation.metrics.NoOpMetricsService;
import com.knowledge.curation.provider.ProviderUnavailableException;
import com.knowledge.curation.store.ItemRepository;
import com.knowledge.curation.store.SessionState;
import com.knowledge.curation.store.SessionStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Unattended multi-round curation.
 *
 * <p>Each round runs the auto-dedup pass, rebuilds the graph, detects communities and drift
 * triads, and routes communities in priority order: automatic merge, LLM adjudication, or the
 * manual-review queue. The loop never waits on a human. After each round the session state
 * is checkpointed, so a restarted run continues with the next round. The loop halts when a
 * round improves less than {@code minImprovementRate}, at {@code maxIterations}, when no
 * candidates are left, or when a provider fails (without advancing the checkpoint). A round
 * that deferred conflicting decisions is always followed by another one, up to the cap.</p>
 *
 * <p>A dry run computes one preview round and persists nothing.</p>
 */
public class ConvergenceLoop {
    private static final Logger log = LoggerFactory.getLogger(ConvergenceLoop.class);

    private final SimilarityGraphBuilder graphBuilder;
    private final CommunityDetector communityDetector;
    private final DriftTriadDetector triadDetector;
    private final DecisionPolicyEngine policyEngine;
    private final AdjudicationService adjudicationService;
    private final MergeEngine mergeEngine;
    private final AutoDedupPass autoDedupPass;
    private final SessionStateRepository stateRepository;
    private final CurationOptions options;
    private final MetricsService metricsService;

    public ConvergenceLoop(SimilarityGraphBuilder graphBuilder,
                           CommunityDetector communityDetector,
                           DriftTriadDetector triadDetector,
                           DecisionPolicyEngine policyEngine,
                           AdjudicationService adjudicationService,
                           MergeEngine mergeEngine,
                           SessionStateRepository stateRepository,
                           CurationOptions options,
                           MetricsService metricsService) {
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "graphBuilder is required");
        this.communityDetector = Objects.requireNonNull(communityDetector, "communityDetector is required");
        this.triadDetector = Objects.requireNonNull(triadDetector, "triadDetector is required");
        this.policyEngine = Objects.requireNonNull(policyEngine, "policyEngine is required");
        this.adjudicationService = Objects.requireNonNull(adjudicationService, "adjudicationService is required");
        this.mergeEngine = Objects.requireNonNull(mergeEngine, "mergeEngine is required");
        this.stateRepository = Objects.requireNonNull(stateRepository, "stateRepository is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.autoDedupPass = new AutoDedupPass(mergeEngine, options);
    }

    /**
     * Runs (or resumes) the loop for the given session id.
     */
    public ConvergenceReport run(String sessionId) {
        ItemRepository items = mergeEngine.getItemRepository();
        boolean dryRun = mergeEngine.getDecisionLog().isDryRun();
        Optional<SessionState> saved = stateRepository.load(sessionId);
        SessionState state = saved.orElseGet(() -> SessionState.newConvergence(sessionId, items.countActive()));
        List<String> warnings = new ArrayList<>();

        if (state.completed()) {
            log.info("convergence.already-completed sessionId={} rounds={}", sessionId, state.roundCounter());
            return report(state, items, finishedReason(state), warnings, dryRun);
        }
        if (saved.isPresent()) {
            log.info("convergence.resuming sessionId={} nextRound={}", sessionId, state.roundCounter() + 1);
        } else if (!dryRun) {
            stateRepository.save(state);
        }

        StopReason stopReason;
        int round = state.roundCounter() + 1;
        while (true) {
            if (round > options.getMaxIterations()) {
                stopReason = StopReason.MAX_ITERATIONS;
                break;
            }
            RoundResult result;
            try {
                result = runRound(sessionId, round);
            } catch (ProviderUnavailableException e) {
                log.error("convergence.provider-failure sessionId={} round={} provider={} error={}",
                        sessionId, round, e.getProviderName(), e.getMessage());
                warnings.add("Round " + round + " failed: " + e.getMessage() + " (checkpoint kept at round "
                        + state.roundCounter() + ")");
                stopReason = StopReason.PROVIDER_FAILURE;
                break;
            }

            RoundSummary summary = result.summary();
            state = state.withRound(summary, result.deferred());
            if (!dryRun) {
                stateRepository.save(state);
            }
            metricsService.recordRoundImprovement(summary.improvementRate());
            log.info("convergence.round-completed sessionId={} round={} before={} after={} improvement={}",
                    sessionId, round, summary.activeBefore(), summary.activeAfter(),
                    String.format(Locale.ROOT, "%.4f", summary.improvementRate()));

            if (dryRun) {
                stopReason = StopReason.DRY_RUN_PREVIEW;
                break;
            }
            if (summary.deferredConflicts() > 0) {
                log.info("convergence.conflicts-pending sessionId={} round={} deferred={}",
                        sessionId, round, summary.deferredConflicts());
            } else if (hasNoCandidates(summary)) {
                stopReason = StopReason.NO_CANDIDATES;
                break;
            } else if (summary.improvementRate() < options.getMinImprovementRate()) {
                stopReason = StopReason.CONVERGED;
                break;
            }
            if (round >= options.getMaxIterations()) {
                stopReason = StopReason.MAX_ITERATIONS;
                break;
            }
            round++;
        }

        if (stopReason != StopReason.PROVIDER_FAILURE && !dryRun) {
            state = state.withCompleted(true);
            stateRepository.save(state);
        }
        if (stopReason == StopReason.MAX_ITERATIONS) {
            warnings.add("Stopped at the iteration cap of " + options.getMaxIterations() + " rounds");
        }
        if (dryRun) {
            warnings.add("Dry run: no decisions or item changes were persisted");
        }
        int conflicts = state.rounds().stream().mapToInt(RoundSummary::deferredConflicts).sum();
        if (conflicts > 0) {
            warnings.add(conflicts + " decisions were deferred because their items changed earlier in the round");
        }
        log.info("convergence.stopped sessionId={} reason={} rounds={}", sessionId, stopReason, state.rounds().size());
        return report(state, items, stopReason, warnings, dryRun);
    }

    private RoundResult runRound(String sessionId, int round) {
        try (LogContext ctx = LogContext.forRound(sessionId, round).with("phase", "auto-dedup")) {
            ItemRepository items = mergeEngine.getItemRepository();
            MutationScope autoScope = new MutationScope("round " + round + " auto-dedup");
            int before = items.countActive();

            GraphSnapshot snapshot = graphBuilder.build(items);
            AutoDedupResult autoDedup = autoDedupPass.run(snapshot, triadDetector.detect(snapshot),
                    sessionId, round, autoScope);

            // a rebuilt graph already reflects the auto-dedup merges, a reused one does not
            boolean rebuild = autoDedup.mergedItems() > 0 && !mergeEngine.getDecisionLog().isDryRun();
            GraphSnapshot rebuilt = rebuild ? graphBuilder.build(items) : snapshot;
            MutationScope scope = rebuild ? new MutationScope("round " + round) : autoScope;
            ctx.with("phase", "communities");
            List<DriftTriad> triads = triadDetector.detect(rebuilt);
            List<Community> communities = communityDetector.detectAll(rebuilt);

            RoundCounters counters = new RoundCounters();
            counters.deferredConflicts = autoDedup.deferred();
            List<ManualReviewEntry> deferred = new ArrayList<>();

            int limit = options.getMaxCommunitiesPerRound() > 0
                    ? Math.min(options.getMaxCommunitiesPerRound(), communities.size())
                    : communities.size();
            for (Community community : communities.subList(0, limit)) {
                RoutingDecision routing = policyEngine.route(community, triads);
                try {
                    process(sessionId, round, routing, scope, counters, deferred);
                } catch (ConcurrentMutationConflictException e) {
                    counters.deferredConflicts++;
                    metricsService.incrementDeferredConflict();
                    log.info("convergence.conflict-deferred communityId={} conflicting={}",
                            community.id(), e.getConflictingIds());
                }
            }

            int after = items.countActive();
            int manualItems = deferred.stream().mapToInt(d -> d.members().size()).sum();
            double improvement = improvementRate(before, after, manualItems);
            RoundSummary summary = new RoundSummary(round, before, after, autoDedup.mergedItems(),
                    communities.size(), counters.processed, counters.merges,
                    counters.keptSeparate, counters.splits, deferred.size(), manualItems,
                    counters.deferredConflicts, triads.size(), improvement);
            return new RoundResult(summary, deferred);
        }
    }

    private void process(String sessionId, int round, RoutingDecision routing, MutationScope scope,
                         RoundCounters counters, List<ManualReviewEntry> deferred) {
        Community community = routing.community();
        switch (routing.route()) {
            case AUTO_MERGE -> {
                counters.processed++;
                List<Item> members = activeMembers(community);
                DecisionContext context = context(sessionId, round, DecisionActor.AUTO_THRESHOLD,
                        routing.reason(), community, scope);
                applyMerge(members, CanonicalSelector.select(members).getId(), DecisionAction.MERGE,
                        context, scope, counters);
            }
            case ADJUDICATE -> {
                counters.processed++;
                scope.checkAvailable(community.members());
                List<Item> members = activeMembers(community);
                AdjudicationDecision decision = adjudicationService.adjudicate(
                        new AdjudicationRequest(community, members, routing.triads(), round));
                applyAdjudication(sessionId, round, community, members, decision, scope, counters, deferred);
            }
            case MANUAL_QUEUE, HUMAN_REVIEW -> {
                counters.processed++;
                defer(round, community, routing.reason(), deferred);
            }
            case PREVIEW_ONLY, IGNORE -> log.debug("convergence.skipped communityId={} route={}",
                    community.id(), routing.route());
        }
    }

    private void applyAdjudication(String sessionId, int round, Community community, List<Item> members,
                                   AdjudicationDecision decision, MutationScope scope,
                                   RoundCounters counters, List<ManualReviewEntry> deferred) {
        DecisionContext context = context(sessionId, round, DecisionActor.LLM, decision.rationale(), community, scope)
                .withDetails(Map.of(
                        "confidence", String.format(Locale.ROOT, "%.3f", decision.confidence()),
                        "adjudicator", adjudicationService.getAdjudicator().getProviderName()));
        switch (decision.kind()) {
            case MERGE -> {
                List<String> group = decision.groups().get(0);
                List<Item> groupItems = members.stream().filter(i -> group.contains(i.getId())).toList();
                String canonicalId = decision.canonicalId() != null && group.contains(decision.canonicalId())
                        ? decision.canonicalId()
                        : CanonicalSelector.select(groupItems).getId();
                applyMerge(groupItems, canonicalId, DecisionAction.MERGE, context, scope, counters);
            }
            case MERGE_SUBSET -> {
                for (int g = 0; g < decision.groups().size(); g++) {
                    List<String> group = decision.groups().get(g);
                    List<Item> groupItems = members.stream().filter(i -> group.contains(i.getId())).toList();
                    if (groupItems.isEmpty()) {
                        continue;
                    }
                    String target = decision.canonicalFor(g);
                    String canonicalId = target != null && groupItems.stream().anyMatch(i -> i.getId().equals(target))
                            ? target
                            : CanonicalSelector.select(groupItems).getId();
                    try {
                        applyMerge(groupItems, canonicalId, DecisionAction.MERGE_SUBSET, context, scope, counters);
                    } catch (ConcurrentMutationConflictException e) {
                        counters.deferredConflicts++;
                        metricsService.incrementDeferredConflict();
                        log.info("convergence.conflict-deferred communityId={} group={}", community.id(), group);
                    }
                }
            }
            case KEEP_SEPARATE -> {
                mergeEngine.recordOnly(community.members(), DecisionAction.KEEP_SEPARATE, context);
                counters.keptSeparate++;
            }
            case SPLIT -> {
                String groups = decision.groups().stream()
                        .map(g -> String.join(",", g))
                        .collect(Collectors.joining(" | "));
                mergeEngine.recordOnly(community.members(), DecisionAction.SPLIT,
                        context.withDetails(Map.of("groups", groups)));
                counters.splits++;
            }
            case MANUAL_REVIEW -> defer(round, community, decision.rationale(), deferred);
        }
    }

    private void applyMerge(List<Item> members, String canonicalId, DecisionAction action,
                            DecisionContext context, MutationScope scope, RoundCounters counters) {
        if (members.size() < 2) {
            return;
        }
        List<String> subject = members.stream().map(Item::getId).toList();
        MergeResult result = mergeEngine.merge(subject, canonicalId, action, context);
        if (result.isFailure()) {
            log.warn("convergence.merge-failed canonicalId={} error={}", canonicalId, result.errorMessage());
            return;
        }
        if (result.dryRun()) {
            scope.markTouched(subject);
        }
        counters.merges += result.affectedIds().size();
    }

    private void defer(int round, Community community, String reason, List<ManualReviewEntry> deferred) {
        deferred.add(new ManualReviewEntry(round, community.id(), community.category(), community.members(),
                community.avgSimilarity(), reason));
        metricsService.incrementManualReview();
        log.info("convergence.manual-review communityId={} size={} reason={}",
                community.id(), community.size(), reason);
    }

    private List<Item> activeMembers(Community community) {
        ItemRepository items = mergeEngine.getItemRepository();
        return community.members().stream()
                .map(items::findById)
                .flatMap(Optional::stream)
                .filter(Item::isActive)
                .toList();
    }

    private DecisionContext context(String sessionId, int round, DecisionActor actor, String rationale,
                                    Community community, MutationScope scope) {
        Map<String, String> details = new HashMap<>();
        details.put("communityId", community.id());
        details.put("category", community.category());
        details.put("avgSimilarity", String.format(Locale.ROOT, "%.4f", community.avgSimilarity()));
        return new DecisionContext(sessionId, round, actor, rationale, details, scope);
    }

    /**
     * {@code (before - after) / (before - manualReviewItems)}; 0.0 when nothing is left to improve.
     */
    static double improvementRate(int before, int after, int manualReviewItems) {
        int denominator = before - manualReviewItems;
        if (denominator <= 0) {
            return 0.0;
        }
        return (double) (before - after) / denominator;
    }

    private static boolean hasNoCandidates(RoundSummary summary) {
        return summary.autoDedupMerges() == 0 && summary.communities() == 0 && summary.triads() == 0;
    }

    private StopReason finishedReason(SessionState state) {
        if (state.rounds().isEmpty()) {
            return StopReason.NO_CANDIDATES;
        }
        RoundSummary last = state.rounds().get(state.rounds().size() - 1);
        if (last.deferredConflicts() > 0) {
            return StopReason.MAX_ITERATIONS;
        }
        if (hasNoCandidates(last)) {
            return StopReason.NO_CANDIDATES;
        }
        return last.improvementRate() < options.getMinImprovementRate()
                ? StopReason.CONVERGED
                : StopReason.MAX_ITERATIONS;
    }

    private ConvergenceReport report(SessionState state, ItemRepository items, StopReason stopReason,
                                     List<String> warnings, boolean dryRun) {
        return new ConvergenceReport(state.sessionId(), state.initialItemCount(), items.countActive(),
                state.rounds(), stopReason, state.manualReviewQueue(), warnings, dryRun, null);
    }

    private record RoundResult(RoundSummary summary, List<ManualReviewEntry> deferred) {
    }

    private static final class RoundCounters {
        int processed;
        int merges;
        int keptSeparate;
        int splits;
        int deferredConflicts;
    }
}
