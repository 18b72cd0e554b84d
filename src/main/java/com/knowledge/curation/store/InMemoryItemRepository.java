package com.knowledge.curation.store;

import com.knowledge.curation.core.model.Item;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ItemRepository.
 * Stores live item instances; suitable for tests and single-process runs.
 */
public class InMemoryItemRepository implements ItemRepository {

    private final ConcurrentMap<String, Item> items = new ConcurrentHashMap<>();

    public InMemoryItemRepository() {
    }

    public InMemoryItemRepository(Collection<Item> initial) {
        initial.forEach(this::save);
    }

    @Override
    public Optional<Item> findById(String id) {
        return Optional.ofNullable(items.get(id));
    }

    @Override
    public List<Item> findAll() {
        return items.values().stream()
                .sorted(Comparator.comparing(Item::getId))
                .collect(Collectors.toList());
    }

    @Override
    public List<Item> findByCategory(String category) {
        return items.values().stream()
                .filter(i -> i.getCategory().equals(category))
                .sorted(Comparator.comparing(Item::getId))
                .collect(Collectors.toList());
    }

    @Override
    public List<Item> findActiveByCategory(String category) {
        return findByCategory(category).stream()
                .filter(Item::isActive)
                .collect(Collectors.toList());
    }

    @Override
    public SortedSet<String> categories() {
        return items.values().stream()
                .map(Item::getCategory)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    public List<Item> findMergedInto(String canonicalId) {
        return items.values().stream()
                .filter(i -> i.isMerged() && canonicalId.equals(i.getCanonicalOf()))
                .sorted(Comparator.comparing(Item::getId))
                .collect(Collectors.toList());
    }

    @Override
    public void save(Item item) {
        items.put(item.getId(), item);
    }

    @Override
    public int countActive() {
        return (int) items.values().stream().filter(Item::isActive).count();
    }

    public int size() {
        return items.size();
    }

    public void clear() {
        items.clear();
    }
}
