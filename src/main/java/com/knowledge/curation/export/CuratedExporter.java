package com.knowledge.curation.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.knowledge.curation.audit.DecisionLog;
import com.knowledge.curation.audit.DecisionRecord;
import com.knowledge.curation.core.JsonSupport;
import com.knowledge.curation.core.model.Item;
import com.knowledge.curation.store.ItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Exports the curated knowledge base as a single JSON document.
 *
 * <pre>
 * {
 *   "exportedAt": "...",
 *   "items":     [ {"id", "category", "title", "body", "status", "mergedFrom": [...]} ],
 *   "rejected":  [ ... ]            // only with includeRejected
 *   "decisions": [ DecisionRecord ]
 * }
 * </pre>
 * Items are ordered by category, then id.
 */
public class CuratedExporter {
    private static final Logger log = LoggerFactory.getLogger(CuratedExporter.class);

    private final ItemRepository itemRepository;
    private final DecisionLog decisionLog;
    private final ObjectMapper mapper = JsonSupport.newObjectMapper();

    public CuratedExporter(ItemRepository itemRepository, DecisionLog decisionLog) {
        this.itemRepository = Objects.requireNonNull(itemRepository, "itemRepository is required");
        this.decisionLog = Objects.requireNonNull(decisionLog, "decisionLog is required");
    }

    public ExportResult export(Writer writer, boolean includeRejected) {
        ObjectNode root = mapper.createObjectNode();
        root.put("exportedAt", Instant.now().toString());

        long canonical = 0;
        long rejected = 0;
        ArrayNode itemsNode = root.putArray("items");
        ArrayNode rejectedNode = includeRejected ? mapper.createArrayNode() : null;
        for (String category : itemRepository.categories()) {
            for (Item item : itemRepository.findByCategory(category)) {
                if (item.isActive()) {
                    itemsNode.add(toNode(item));
                    canonical++;
                } else if (rejectedNode != null) {
                    rejectedNode.add(toNode(item));
                    rejected++;
                }
            }
        }
        if (rejectedNode != null) {
            root.set("rejected", rejectedNode);
        }

        List<DecisionRecord> records = decisionLog.getAllRecords();
        root.set("decisions", mapper.valueToTree(records));

        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, root);
        } catch (IOException e) {
            log.error("export.failed error={}", e.getMessage());
            throw new UncheckedIOException("Curated export failed", e);
        }
        ExportResult result = new ExportResult(canonical, rejected, records.size());
        log.info("export.completed result={}", result);
        return result;
    }

    public ExportResult export(Path target, boolean includeRejected) {
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                return export(writer, includeRejected);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write export to " + target, e);
        }
    }

    private ObjectNode toNode(Item item) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", item.getId());
        node.put("category", item.getCategory());
        node.put("title", item.getTitle());
        node.put("body", item.getBody());
        node.put("status", item.getStatus().name());
        if (item.getCanonicalOf() != null) {
            node.put("canonicalOf", item.getCanonicalOf());
        }
        if (item.isActive()) {
            ArrayNode mergedFrom = node.putArray("mergedFrom");
            itemRepository.findMergedInto(item.getId()).stream()
                    .map(Item::getId)
                    .sorted()
                    .forEach(mergedFrom::add);
        }
        node.put("updatedAt", item.getUpdatedAt().toString());
        return node;
    }
}
