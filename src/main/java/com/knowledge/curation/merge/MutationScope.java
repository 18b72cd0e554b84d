package com.knowledge.curation.merge;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Items mutated so far in one round. A later decision touching any of them is deferred.
 */
public class MutationScope {

    private final String name;
    private final Set<String> touched = new HashSet<>();

    public MutationScope(String name) {
        this.name = name;
    }

    /**
     * @throws ConcurrentMutationConflictException if any id was already mutated in this scope
     */
    public void checkAvailable(Collection<String> itemIds) {
        List<String> conflicts = itemIds.stream()
                .filter(touched::contains)
                .sorted()
                .collect(Collectors.toList());
        if (!conflicts.isEmpty()) {
            throw new ConcurrentMutationConflictException("Items already mutated in " + name + ":", conflicts);
        }
    }

    public void markTouched(Collection<String> itemIds) {
        touched.addAll(itemIds);
    }

    public boolean isTouched(String itemId) {
        return touched.contains(itemId);
    }

    public int size() {
        return touched.size();
    }

    public String getName() {
        return name;
    }
}
