package com.knowledge.curation.api;

import com.knowledge.curation.audit.DecisionLog;
import com.knowledge.curation.audit.DecisionLogRepository;
import com.knowledge.curation.audit.InMemoryDecisionLogRepository;
import com.knowledge.curation.cache.CacheConfig;
import com.knowledge.curation.cache.CaffeineNeighborCache;
import com.knowledge.curation.cache.NeighborCache;
import com.knowledge.curation.cache.NoOpNeighborCache;
import com.knowledge.curation.community.CommunityDetector;
import com.knowledge.curation.community.LouvainCommunityDetector;
import com.knowledge.curation.config.CurationOptions;
import com.knowledge.curation.convergence.AutoDedupPass;
import com.knowledge.curation.convergence.AutoDedupResult;
import com.knowledge.curation.convergence.ConvergenceLoop;
import com.knowledge.curation.convergence.ConvergenceReport;
import com.knowledge.curation.convergence.MorningReportWriter;
import com.knowledge.curation.core.model.Community;
import com.knowledge.curation.core.model.ReviewQueueEntry;
import com.knowledge.curation.decision.Bucket;
import com.knowledge.curation.decision.DecisionPolicyEngine;
import com.knowledge.curation.decision.PolicyMode;
import com.knowledge.curation.drift.DriftTriad;
import com.knowledge.curation.drift.DriftTriadDetector;
import com.knowledge.curation.export.CuratedExporter;
import com.knowledge.curation.export.ExportResult;
import com.knowledge.curation.graph.GraphSnapshot;
import com.knowledge.curation.graph.SimilarityGraphBuilder;
import com.knowledge.curation.llm.AdjudicationService;
import com.knowledge.curation.llm.LLMAdjudicator;
import com.knowledge.curation.llm.NoOpLLMAdjudicator;
import com.knowledge.curation.merge.MergeEngine;
import com.knowledge.curation.merge.MutationScope;
import com.knowledge.curation.metrics.MetricsService;
import com.knowledge.curation.metrics.NoOpMetricsService;
import com.knowledge.curation.provider.RerankProvider;
import com.knowledge.curation.provider.VectorProvider;
import com.knowledge.curation.review.ReviewQueueBuilder;
import com.knowledge.curation.review.ReviewSession;
import com.knowledge.curation.store.InMemoryItemRepository;
import com.knowledge.curation.store.InMemorySessionStateRepository;
import com.knowledge.curation.store.ItemRepository;
import com.knowledge.curation.store.SessionStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point for the curation library.
 * Wires the graph builder, detectors, policy engine, adjudication and merge engine
 * around the caller's repositories and providers.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * CurationEngine engine = CurationEngine.builder()
 *     .itemRepository(items)
 *     .vectorProvider(vectors)
 *     .llmAdjudicator(OllamaLLMAdjudicator.builder().model("llama3.1").build())
 *     .decisionLogRepository(new JsonLinesDecisionLogRepository(Path.of("data/decisions.jsonl")))
 *     .sessionStateRepository(new JsonFileSessionStateRepository(Path.of("data/sessions")))
 *     .options(CurationOptions.defaults())
 *     .build();
 *
 * // Unattended run
 * ConvergenceReport report = engine.runConvergence("nightly-2024-06-01");
 * engine.writeMorningReport(report, Path.of("data/morning_report.md"));
 *
 * // Human review of one bucket
 * ReviewSession session = engine.startReview("review-1", "skill", Bucket.HIGH);
 * new ConsoleReviewRunner(in, out).run(session);
 * </pre>
 */
public class CurationEngine {
    private static final Logger log = LoggerFactory.getLogger(CurationEngine.class);

    private final CurationOptions options;
    private final ItemRepository itemRepository;
    private final SessionStateRepository sessionStateRepository;
    private final DecisionLog decisionLog;
    private final MergeEngine mergeEngine;
    private final SimilarityGraphBuilder graphBuilder;
    private final CommunityDetector communityDetector;
    private final DriftTriadDetector triadDetector;
    private final AdjudicationService adjudicationService;
    private final MetricsService metricsService;

    private CurationEngine(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.itemRepository = builder.itemRepository != null
                ? builder.itemRepository : new InMemoryItemRepository();
        this.sessionStateRepository = builder.sessionStateRepository != null
                ? builder.sessionStateRepository : new InMemorySessionStateRepository();

        DecisionLogRepository logRepository = builder.decisionLogRepository != null
                ? builder.decisionLogRepository : new InMemoryDecisionLogRepository();
        this.decisionLog = new DecisionLog(logRepository, metricsService, options.isDryRun());
        this.mergeEngine = new MergeEngine(itemRepository, decisionLog);

        NeighborCache cache = builder.neighborCache;
        if (cache == null) {
            cache = builder.cacheConfig != null && builder.cacheConfig.enabled()
                    ? new CaffeineNeighborCache(builder.cacheConfig) : new NoOpNeighborCache();
        }
        this.graphBuilder = new SimilarityGraphBuilder(builder.vectorProvider, builder.rerankProvider,
                cache, options, metricsService);
        // Updated items must not be scored with stale neighbors
        mergeEngine.addEmbeddingChangeListener(graphBuilder);

        this.communityDetector = builder.communityDetector != null
                ? builder.communityDetector
                : new LouvainCommunityDetector(options.getCommunitySeed(), options.getCommunityResolution(),
                        options.getMaxCommunitySize());
        this.triadDetector = new DriftTriadDetector(options.getHighBucketThreshold());

        LLMAdjudicator adjudicator = builder.llmAdjudicator != null
                ? builder.llmAdjudicator : new NoOpLLMAdjudicator();
        this.adjudicationService = new AdjudicationService(adjudicator, options, metricsService);

        log.info("CurationEngine initialized: vectorProvider={}, adjudicator={}, dryRun={}",
                builder.vectorProvider.getProviderName(), adjudicator.getProviderName(), options.isDryRun());
    }

    // ========== Graph API ==========

    /**
     * Builds a fresh similarity graph snapshot of all categories.
     */
    public GraphSnapshot buildGraph() {
        return graphBuilder.build(itemRepository);
    }

    public List<DriftTriad> detectTriads(GraphSnapshot snapshot) {
        return triadDetector.detect(snapshot);
    }

    /**
     * Communities of all categories in processing order.
     */
    public List<Community> detectCommunities(GraphSnapshot snapshot) {
        return communityDetector.detectAll(snapshot);
    }

    // ========== Automated API ==========

    /**
     * Runs a single auto-dedup pass over a fresh graph.
     */
    public AutoDedupResult autoDedup(String sessionId) {
        GraphSnapshot snapshot = buildGraph();
        return new AutoDedupPass(mergeEngine, options)
                .run(snapshot, triadDetector.detect(snapshot), sessionId, null, new MutationScope("auto-dedup"));
    }

    /**
     * Runs or resumes the convergence loop.
     */
    public ConvergenceReport runConvergence(String sessionId) {
        ConvergenceLoop loop = new ConvergenceLoop(graphBuilder, communityDetector, triadDetector,
                new DecisionPolicyEngine(options, PolicyMode.AUTOMATED), adjudicationService, mergeEngine,
                sessionStateRepository, options, metricsService);
        return loop.run(sessionId);
    }

    public Path writeMorningReport(ConvergenceReport report, Path target) {
        return new MorningReportWriter().write(report, target);
    }

    // ========== Review API ==========

    /**
     * Builds the review queue of one category and bucket from a fresh graph.
     */
    public List<ReviewQueueEntry> buildReviewQueue(String category, Bucket bucket) {
        ReviewQueueBuilder queueBuilder = new ReviewQueueBuilder(
                new DecisionPolicyEngine(options, PolicyMode.INTERACTIVE), communityDetector, triadDetector);
        return queueBuilder.build(graphBuilder.buildCategory(itemRepository, category), bucket);
    }

    public ReviewSession startReview(String sessionId, String category, Bucket bucket) {
        List<ReviewQueueEntry> queue = buildReviewQueue(category, bucket);
        return ReviewSession.start(sessionId, category, bucket, queue, mergeEngine, sessionStateRepository);
    }

    public ReviewSession resumeReview(String sessionId) {
        return ReviewSession.resume(sessionId, mergeEngine, sessionStateRepository);
    }

    // ========== Export API ==========

    public ExportResult export(Path target, boolean includeRejected) {
        return new CuratedExporter(itemRepository, decisionLog).export(target, includeRejected);
    }

    // ========== Service Access ==========

    public CurationOptions getOptions() {
        return options;
    }

    public ItemRepository getItemRepository() {
        return itemRepository;
    }

    public DecisionLog getDecisionLog() {
        return decisionLog;
    }

    public MergeEngine getMergeEngine() {
        return mergeEngine;
    }

    public SimilarityGraphBuilder getGraphBuilder() {
        return graphBuilder;
    }

    public SessionStateRepository getSessionStateRepository() {
        return sessionStateRepository;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ItemRepository itemRepository;
        private VectorProvider vectorProvider;
        private RerankProvider rerankProvider;
        private LLMAdjudicator llmAdjudicator;
        private DecisionLogRepository decisionLogRepository;
        private SessionStateRepository sessionStateRepository;
        private NeighborCache neighborCache;
        private CacheConfig cacheConfig;
        private CommunityDetector communityDetector;
        private CurationOptions options = CurationOptions.defaults();
        private MetricsService metricsService;

        public Builder itemRepository(ItemRepository itemRepository) {
            this.itemRepository = itemRepository;
            return this;
        }

        public Builder vectorProvider(VectorProvider vectorProvider) {
            this.vectorProvider = vectorProvider;
            return this;
        }

        /**
         * Optional second-stage scorer; without one edges use the embedding score only.
         */
        public Builder rerankProvider(RerankProvider rerankProvider) {
            this.rerankProvider = rerankProvider;
            return this;
        }

        public Builder llmAdjudicator(LLMAdjudicator llmAdjudicator) {
            this.llmAdjudicator = llmAdjudicator;
            return this;
        }

        public Builder decisionLogRepository(DecisionLogRepository decisionLogRepository) {
            this.decisionLogRepository = decisionLogRepository;
            return this;
        }

        public Builder sessionStateRepository(SessionStateRepository sessionStateRepository) {
            this.sessionStateRepository = sessionStateRepository;
            return this;
        }

        public Builder neighborCache(NeighborCache neighborCache) {
            this.neighborCache = neighborCache;
            return this;
        }

        /**
         * Enables the Caffeine neighbor cache with the given settings.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder communityDetector(CommunityDetector communityDetector) {
            this.communityDetector = communityDetector;
            return this;
        }

        public Builder options(CurationOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public CurationEngine build() {
            Objects.requireNonNull(vectorProvider, "vectorProvider is required");
            Objects.requireNonNull(options, "options is required");
            return new CurationEngine(this);
        }
    }
}
