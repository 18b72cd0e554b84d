package com.knowledge.curation.audit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of DecisionLogRepository.
 * Thread-safe via CopyOnWriteArrayList.
 */
public class InMemoryDecisionLogRepository implements DecisionLogRepository {

    private final List<DecisionRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public DecisionRecord append(DecisionRecord record) {
        records.add(record);
        return record;
    }

    @Override
    public List<DecisionRecord> findAll() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    @Override
    public List<DecisionRecord> findBySessionId(String sessionId) {
        return records.stream()
                .filter(r -> sessionId.equals(r.sessionId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<DecisionRecord> findBySubject(String itemId) {
        return records.stream()
                .filter(r -> r.subject().contains(itemId))
                .collect(Collectors.toList());
    }

    @Override
    public List<DecisionRecord> findBetween(Instant start, Instant end) {
        return records.stream()
                .filter(r -> !r.timestamp().isBefore(start) && !r.timestamp().isAfter(end))
                .collect(Collectors.toList());
    }

    @Override
    public int count() {
        return records.size();
    }
}
