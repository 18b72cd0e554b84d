package com.knowledge.curation.convergence;

import com.knowledge.curation.audit.DecisionRecord;
import com.knowledge.curation.community.UnionFind;
import com.knowledge.curation.config.CurationOptions;
import com.knowledge.curation.core.model.DecisionAction;
import com.knowledge.curation.core.model.DecisionActor;
import com.knowledge.curation.core.model.Edge;
import com.knowledge.curation.core.model.Item;
import com.knowledge.curation.drift.DriftTriad;
import com.knowledge.curation.graph.GraphSnapshot;
import com.knowledge.curation.graph.SimilarityGraph;
import com.knowledge.curation.merge.CanonicalSelector;
import com.knowledge.curation.merge.ConcurrentMutationConflictException;
import com.knowledge.curation.merge.DecisionContext;
import com.knowledge.curation.merge.MergeEngine;
import com.knowledge.curation.merge.MergeResult;
import com.knowledge.curation.merge.MutationScope;
import com.knowledge.curation.store.ItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Merges every group of items connected by edges at or above the auto-dedup threshold.
 *
 * <p>Groups are the connected components (union-find) of those edges, per category.
 * Edges touching an item that takes part in a drift triad are left out so that triads
 * are never resolved automatically. The surviving item is chosen by
 * {@link CanonicalSelector}; each group yields exactly one MERGE record with actor
 * AUTO_THRESHOLD. Running the pass again on the merged store finds nothing.</p>
 */
public class AutoDedupPass {
    private static final Logger log = LoggerFactory.getLogger(AutoDedupPass.class);

    private final MergeEngine mergeEngine;
    private final CurationOptions options;

    public AutoDedupPass(MergeEngine mergeEngine, CurationOptions options) {
        this.mergeEngine = Objects.requireNonNull(mergeEngine, "mergeEngine is required");
        this.options = Objects.requireNonNull(options, "options is required");
    }

    public AutoDedupResult run(GraphSnapshot snapshot, List<DriftTriad> triads, String sessionId,
                               Integer round, MutationScope scope) {
        Set<String> triadMembers = new HashSet<>();
        for (DriftTriad triad : triads) {
            triadMembers.addAll(triad.members());
        }

        List<List<String>> allGroups = new ArrayList<>();
        List<DecisionRecord> records = new ArrayList<>();
        int mergedItems = 0;
        int deferred = 0;
        int excluded = 0;
        ItemRepository items = mergeEngine.getItemRepository();

        for (SimilarityGraph graph : snapshot.graphs().values()) {
            UnionFind unionFind = new UnionFind();
            for (Edge edge : graph.edgesAtOrAbove(options.getAutoDedupThreshold())) {
                if (triadMembers.contains(edge.aId()) || triadMembers.contains(edge.bId())) {
                    excluded++;
                    continue;
                }
                unionFind.union(edge.aId(), edge.bId());
            }

            for (List<String> group : unionFind.groups()) {
                List<Item> members = group.stream()
                        .map(items::findById)
                        .flatMap(Optional::stream)
                        .filter(Item::isActive)
                        .toList();
                if (members.size() < 2) {
                    continue;
                }
                allGroups.add(group);
                String canonicalId = CanonicalSelector.select(members).getId();
                List<String> subject = members.stream().map(Item::getId).toList();
                DecisionContext context = new DecisionContext(sessionId, round, DecisionActor.AUTO_THRESHOLD,
                        String.format(Locale.ROOT, "all links >= auto threshold %.2f", options.getAutoDedupThreshold()),
                        Map.of("category", graph.category(), "pass", "auto_dedup"), scope);
                try {
                    MergeResult result = mergeEngine.merge(subject, canonicalId, DecisionAction.MERGE, context);
                    if (result.isFailure()) {
                        log.warn("auto-dedup.failed canonicalId={} error={}", canonicalId, result.errorMessage());
                        continue;
                    }
                    if (result.dryRun() && scope != null) {
                        scope.markTouched(subject);
                    }
                    records.add(result.record());
                    mergedItems += result.affectedIds().size();
                } catch (ConcurrentMutationConflictException e) {
                    deferred++;
                    log.info("auto-dedup.deferred canonicalId={} conflicting={}", canonicalId, e.getConflictingIds());
                }
            }
        }

        log.info("auto-dedup.completed groups={} merged={} deferred={} excludedEdges={}",
                allGroups.size(), mergedItems, deferred, excluded);
        return new AutoDedupResult(allGroups, records, mergedItems, deferred, excluded);
    }
}
