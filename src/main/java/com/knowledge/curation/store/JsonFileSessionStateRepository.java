package com.knowledge.curation.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledge.curation.core.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores each session as {@code <directory>/<sessionId>.json}.
 * Writes go to a temporary file that is then moved over the target.
 */
public class JsonFileSessionStateRepository implements SessionStateRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonFileSessionStateRepository.class);

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonFileSessionStateRepository(Path directory) {
        this.directory = directory;
        this.mapper = JsonSupport.newObjectMapper();
    }

    @Override
    public void save(SessionState state) {
        Path target = fileFor(state.sessionId());
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(directory);
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), state);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("session.saved sessionId={} cursor={} round={}",
                    state.sessionId(), state.cursor(), state.roundCounter());
        } catch (IOException e) {
            throw new SessionStatePersistenceException("Failed to save session " + state.sessionId(), e);
        }
    }

    @Override
    public Optional<SessionState> load(String sessionId) {
        Path file = fileFor(sessionId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), SessionState.class));
        } catch (IOException e) {
            throw new SessionStatePersistenceException("Failed to read session " + sessionId, e);
        }
    }

    @Override
    public void delete(String sessionId) {
        try {
            Files.deleteIfExists(fileFor(sessionId));
        } catch (IOException e) {
            throw new SessionStatePersistenceException("Failed to delete session " + sessionId, e);
        }
    }

    private Path fileFor(String sessionId) {
        if (sessionId.contains("/") || sessionId.contains("\\") || sessionId.contains("..")) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
        return directory.resolve(sessionId + ".json");
    }
}
