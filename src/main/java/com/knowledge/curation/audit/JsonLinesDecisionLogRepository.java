package com.knowledge.curation.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledge.curation.core.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

/**
 * File-backed decision log storing one JSON document per line.
 * Each append is written with DSYNC before it becomes visible to readers, so a record
 * that was reported as appended survives a crash.
 */
public class JsonLinesDecisionLogRepository implements DecisionLogRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesDecisionLogRepository.class);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final InMemoryDecisionLogRepository index = new InMemoryDecisionLogRepository();

    public JsonLinesDecisionLogRepository(Path file) {
        this.file = file;
        this.objectMapper = JsonSupport.newObjectMapper();
        load();
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                index.append(objectMapper.readValue(line, DecisionRecord.class));
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt decision log " + file + " at line " + lineNumber, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read decision log " + file, e);
        }
        log.info("decision-log.loaded file={} records={}", file, index.count());
    }

    @Override
    public synchronized DecisionRecord append(DecisionRecord record) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String line = objectMapper.writeValueAsString(record) + System.lineSeparator();
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.DSYNC);
        } catch (IOException e) {
            throw new DecisionPersistenceException("Could not append decision " + record.id() + " to " + file, e);
        }
        return index.append(record);
    }

    @Override
    public List<DecisionRecord> findAll() {
        return index.findAll();
    }

    @Override
    public List<DecisionRecord> findBySessionId(String sessionId) {
        return index.findBySessionId(sessionId);
    }

    @Override
    public List<DecisionRecord> findBySubject(String itemId) {
        return index.findBySubject(itemId);
    }

    @Override
    public List<DecisionRecord> findBetween(Instant start, Instant end) {
        return index.findBetween(start, end);
    }

    @Override
    public int count() {
        return index.count();
    }

    public Path getFile() {
        return file;
    }
}
