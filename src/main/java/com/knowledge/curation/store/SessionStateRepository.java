package com.knowledge.curation.store;

import java.util.Optional;

/**
 * Storage for session checkpoints. A save replaces the previous snapshot atomically.
 */
public interface SessionStateRepository {

    void save(SessionState state);

    Optional<SessionState> load(String sessionId);

    void delete(String sessionId);
}
