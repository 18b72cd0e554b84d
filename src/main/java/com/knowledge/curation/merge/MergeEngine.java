package com.knowledge.curation.merge;

import com.knowledge.curation.audit.DecisionLog;
import com.knowledge.curation.audit.DecisionRecord;
import com.knowledge.curation.cache.EmbeddingChangeListener;
import com.knowledge.curation.core.model.DecisionAction;
import com.knowledge.curation.core.model.Item;
import com.knowledge.curation.logging.LogContext;
import com.knowledge.curation.store.ItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Applies curation decisions to the item store.
 *
 * <p>Every mutating decision is written to the {@link DecisionLog} first; if that write
 * fails nothing is mutated. Mutations of several items run inside a
 * {@link MergeTransaction} so that a failure half way restores the earlier snapshots.
 * Canonical pointers are flattened to depth one: when an item that already absorbed
 * others is merged away, those others are re-pointed at the new canonical.</p>
 *
 * <p>In dry-run mode decisions are validated and logged but neither recorded nor applied.</p>
 */
public class MergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private final ItemRepository itemRepository;
    private final DecisionLog decisionLog;
    private final List<EmbeddingChangeListener> embeddingListeners = new CopyOnWriteArrayList<>();

    public MergeEngine(ItemRepository itemRepository, DecisionLog decisionLog) {
        this.itemRepository = Objects.requireNonNull(itemRepository, "itemRepository is required");
        this.decisionLog = Objects.requireNonNull(decisionLog, "decisionLog is required");
    }

    /**
     * Merges every subject item except the canonical into the canonical.
     *
     * @param subject     items taking part, including the canonical
     * @param canonicalId surviving item
     * @param action      MERGE or MERGE_SUBSET
     * @throws ConcurrentMutationConflictException if an item was already mutated in the
     *                                             context's scope or is no longer active
     * @throws com.knowledge.curation.audit.DecisionPersistenceException if the record could not be written
     */
    public MergeResult merge(List<String> subject, String canonicalId, DecisionAction action, DecisionContext context) {
        if (action != DecisionAction.MERGE && action != DecisionAction.MERGE_SUBSET) {
            throw new IllegalArgumentException("Not a merge action: " + action);
        }
        List<String> ids = distinct(subject);
        if (ids.size() < 2) {
            throw new IllegalArgumentException("A merge needs at least two items: " + subject);
        }
        if (!ids.contains(canonicalId)) {
            throw new IllegalArgumentException("Canonical " + canonicalId + " is not part of " + ids);
        }
        List<Item> items = loadActive(ids, context);
        requireSameCategory(items);

        DecisionRecord record = decisionLog.record(newRecord(ids, action, canonicalId, context));
        List<String> mergedIds = ids.stream().filter(id -> !id.equals(canonicalId)).toList();
        if (decisionLog.isDryRun()) {
            return MergeResult.preview(record, mergedIds);
        }

        try (LogContext logCtx = LogContext.forMerge(record.id(), canonicalId)) {
            log.info("merge.starting canonicalId={} merged={} actor={}", canonicalId, mergedIds, context.actor());
            try (MergeTransaction tx = new MergeTransaction()) {
                for (Item item : items) {
                    if (item.getId().equals(canonicalId)) {
                        continue;
                    }
                    for (Item dependent : itemRepository.findMergedInto(item.getId())) {
                        Item dependentSnapshot = dependent.copy();
                        tx.execute("re-point " + dependent.getId(),
                                () -> {
                                    dependent.repointCanonical(canonicalId);
                                    itemRepository.save(dependent);
                                },
                                () -> itemRepository.save(dependentSnapshot));
                    }
                    Item snapshot = item.copy();
                    tx.execute("merge " + item.getId(),
                            () -> {
                                item.markMergedInto(canonicalId);
                                itemRepository.save(item);
                            },
                            () -> itemRepository.save(snapshot));
                }
                tx.markSuccess();
            } catch (RuntimeException e) {
                log.error("merge.failed canonicalId={} recordId={} error={}", canonicalId, record.id(), e.getMessage());
                return MergeResult.failure(record, "Merge failed: " + e.getMessage());
            }
            markTouched(context, ids);
            log.info("merge.completed canonicalId={} merged={}", canonicalId, mergedIds.size());
            return MergeResult.success(record, mergedIds);
        }
    }

    /**
     * Rejects an item without a merge target.
     *
     * @throws IllegalStateException if other items are merged into it
     */
    public MergeResult reject(String itemId, DecisionContext context) {
        Item item = loadActive(List.of(itemId), context).get(0);
        List<Item> dependents = itemRepository.findMergedInto(itemId);
        if (!dependents.isEmpty()) {
            throw new IllegalStateException("Item " + itemId + " is the canonical of " + dependents.size()
                    + " merged items; merge it into another item instead of rejecting it");
        }
        DecisionRecord record = decisionLog.record(newRecord(List.of(itemId), DecisionAction.REJECT, null, context));
        if (decisionLog.isDryRun()) {
            return MergeResult.preview(record, List.of(itemId));
        }
        item.markRejected();
        itemRepository.save(item);
        markTouched(context, List.of(itemId));
        log.info("item.rejected itemId={} actor={}", itemId, context.actor());
        return MergeResult.success(record, List.of(itemId));
    }

    /**
     * Updates an item's title and/or body and marks its embedding stale.
     */
    public MergeResult update(String itemId, String title, String body, DecisionContext context) {
        if (title == null && body == null) {
            throw new IllegalArgumentException("Nothing to update for " + itemId);
        }
        Item item = loadActive(List.of(itemId), context).get(0);
        Map<String, String> changes = new HashMap<>();
        if (title != null) {
            changes.put("title", title);
        }
        if (body != null) {
            changes.put("body", body);
        }
        DecisionRecord record = decisionLog.record(
                newRecord(List.of(itemId), DecisionAction.UPDATE, null, context.withDetails(changes)));
        if (decisionLog.isDryRun()) {
            return MergeResult.preview(record, List.of(itemId));
        }
        item.updateContent(title, body);
        itemRepository.save(item);
        markTouched(context, List.of(itemId));
        notifyEmbeddingChanged(itemId);
        log.info("item.updated itemId={} fields={}", itemId, changes.keySet());
        return MergeResult.success(record, List.of(itemId));
    }

    /**
     * Records a decision that does not mutate items (KEEP_SEPARATE or SPLIT).
     */
    public DecisionRecord recordOnly(List<String> subject, DecisionAction action, DecisionContext context) {
        if (action.isMutating()) {
            throw new IllegalArgumentException(action + " mutates items; use the matching operation");
        }
        DecisionRecord record = decisionLog.record(newRecord(distinct(subject), action, null, context));
        log.debug("decision.noted action={} subject={}", action, subject);
        return record;
    }

    public void addEmbeddingChangeListener(EmbeddingChangeListener listener) {
        if (listener != null) {
            embeddingListeners.add(listener);
        }
    }

    private List<Item> loadActive(List<String> ids, DecisionContext context) {
        if (context.scope() != null) {
            context.scope().checkAvailable(ids);
        }
        List<Item> items = new ArrayList<>();
        List<String> stale = new ArrayList<>();
        for (String id : ids) {
            Optional<Item> item = itemRepository.findById(id);
            if (item.isEmpty()) {
                throw new IllegalArgumentException("Unknown item: " + id);
            }
            if (!item.get().isActive()) {
                stale.add(id);
            }
            items.add(item.get());
        }
        if (!stale.isEmpty()) {
            throw new ConcurrentMutationConflictException("Items are no longer active:", stale);
        }
        return items;
    }

    private void requireSameCategory(List<Item> items) {
        String category = items.get(0).getCategory();
        for (Item item : items) {
            if (!category.equals(item.getCategory())) {
                throw new IllegalArgumentException("Cannot merge across categories: "
                        + items.get(0).getId() + " (" + category + ") and "
                        + item.getId() + " (" + item.getCategory() + ")");
            }
        }
    }

    private DecisionRecord newRecord(List<String> subject, DecisionAction action, String canonicalId,
                                     DecisionContext context) {
        return DecisionRecord.builder()
                .sessionId(context.sessionId())
                .round(context.round())
                .subject(subject)
                .action(action)
                .actor(context.actor())
                .canonicalId(canonicalId)
                .rationale(context.rationale())
                .details(context.details())
                .build();
    }

    private void markTouched(DecisionContext context, List<String> ids) {
        if (context.scope() != null) {
            context.scope().markTouched(ids);
        }
    }

    private void notifyEmbeddingChanged(String itemId) {
        for (EmbeddingChangeListener listener : embeddingListeners) {
            try {
                listener.onEmbeddingChanged(itemId);
            } catch (RuntimeException e) {
                log.warn("Embedding change listener failed for {}: {}", itemId, e.getMessage());
            }
        }
    }

    private static List<String> distinct(List<String> ids) {
        return new ArrayList<>(new LinkedHashSet<>(ids));
    }

    public DecisionLog getDecisionLog() {
        return decisionLog;
    }

    public ItemRepository getItemRepository() {
        return itemRepository;
    }
}
