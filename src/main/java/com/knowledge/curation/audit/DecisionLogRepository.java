package com.knowledge.curation.audit;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for decision record persistence.
 * Implementations provide different storage backends (in-memory, JSON lines file, ...).
 * Records are append-only: there is no update or delete.
 */
public interface DecisionLogRepository {

    /**
     * Durably appends a record.
     *
     * @throws DecisionPersistenceException if the record could not be written
     */
    DecisionRecord append(DecisionRecord record);

    /**
     * Gets all records in append order.
     */
    List<DecisionRecord> findAll();

    /**
     * Gets records produced by a session or convergence run.
     */
    List<DecisionRecord> findBySessionId(String sessionId);

    /**
     * Gets records whose subject contains the item.
     */
    List<DecisionRecord> findBySubject(String itemId);

    /**
     * Gets records within a time range (inclusive).
     */
    List<DecisionRecord> findBetween(Instant start, Instant end);

    /**
     * Gets the total number of records.
     */
    int count();
}
