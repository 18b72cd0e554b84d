package com.knowledge.curation.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of SessionStateRepository.
 */
public class InMemorySessionStateRepository implements SessionStateRepository {

    private final ConcurrentMap<String, SessionState> states = new ConcurrentHashMap<>();

    @Override
    public void save(SessionState state) {
        states.put(state.sessionId(), state);
    }

    @Override
    public Optional<SessionState> load(String sessionId) {
        return Optional.ofNullable(states.get(sessionId));
    }

    @Override
    public void delete(String sessionId) {
        states.remove(sessionId);
    }
}
