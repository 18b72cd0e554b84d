package com.knowledge.curation.audit;

import com.knowledge.curation.core.model.DecisionAction;
import com.knowledge.curation.core.model.DecisionActor;
import com.knowledge.curation.metrics.MetricsService;
import com.knowledge.curation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Service for recording and querying curation decisions, including merge lineage.
 *
 * <p>All mutating paths go through {@link #record(DecisionRecord)} before touching items.
 * In dry-run mode records are logged but not persisted.</p>
 */
public class DecisionLog {
    private static final Logger log = LoggerFactory.getLogger(DecisionLog.class);

    private final DecisionLogRepository repository;
    private final MetricsService metricsService;
    private final boolean dryRun;

    public DecisionLog() {
        this(new InMemoryDecisionLogRepository(), new NoOpMetricsService(), false);
    }

    public DecisionLog(DecisionLogRepository repository) {
        this(repository, new NoOpMetricsService(), false);
    }

    public DecisionLog(DecisionLogRepository repository, MetricsService metricsService, boolean dryRun) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.dryRun = dryRun;
    }

    /**
     * Durably records a decision.
     *
     * @throws DecisionPersistenceException if the repository failed; callers must not mutate
     */
    public DecisionRecord record(DecisionRecord record) {
        if (dryRun) {
            log.info("decision.dry-run action={} actor={} subject={} canonicalId={}",
                    record.action(), record.actor(), record.subject(), record.canonicalId());
            return record;
        }
        DecisionRecord stored;
        try {
            stored = repository.append(record);
        } catch (DecisionPersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DecisionPersistenceException("Decision " + record.id() + " could not be recorded", e);
        }
        metricsService.incrementDecision(record.action(), record.actor());
        log.debug("decision.recorded id={} action={} actor={} subject={}",
                record.id(), record.action(), record.actor(), record.subject());
        return stored;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public List<DecisionRecord> getAllRecords() {
        return repository.findAll();
    }

    public List<DecisionRecord> getRecordsForSession(String sessionId) {
        return repository.findBySessionId(sessionId);
    }

    public List<DecisionRecord> getRecordsForItem(String itemId) {
        return repository.findBySubject(itemId);
    }

    public List<DecisionRecord> getRecordsByAction(DecisionAction action) {
        return repository.findAll().stream()
                .filter(r -> r.action() == action)
                .collect(Collectors.toList());
    }

    public List<DecisionRecord> getRecordsByActor(DecisionActor actor) {
        return repository.findAll().stream()
                .filter(r -> r.actor() == actor)
                .collect(Collectors.toList());
    }

    public int size() {
        return repository.count();
    }

    /**
     * Gets every item that was merged, directly or through earlier canonicals, into the given item.
     */
    public List<String> getMergeLineage(String canonicalId) {
        Set<String> lineage = new LinkedHashSet<>();
        collectLineage(canonicalId, lineage);
        return new ArrayList<>(lineage);
    }

    private void collectLineage(String canonicalId, Set<String> lineage) {
        for (DecisionRecord record : repository.findBySubject(canonicalId)) {
            if (!record.isMerge() || !canonicalId.equals(record.canonicalId())) {
                continue;
            }
            for (String member : mergedMembers(record)) {
                if (lineage.add(member)) {
                    collectLineage(member, lineage);
                }
            }
        }
    }

    private List<String> mergedMembers(DecisionRecord record) {
        return record.subject().stream()
                .filter(id -> !id.equals(record.canonicalId()))
                .collect(Collectors.toList());
    }
}
