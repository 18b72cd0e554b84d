package com.knowledge.curation.community;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Disjoint-set over item ids with path compression.
 * The smaller id always becomes the root, so groups do not depend on union order.
 */
public class UnionFind {

    private final Map<String, String> parent = new HashMap<>();

    public String find(String x) {
        String p = parent.get(x);
        if (p == null) {
            parent.put(x, x);
            return x;
        }
        if (!p.equals(x)) {
            String root = find(p);
            parent.put(x, root);
            return root;
        }
        return x;
    }

    public void union(String a, String b) {
        String rootA = find(a);
        String rootB = find(b);
        if (rootA.equals(rootB)) {
            return;
        }
        if (rootA.compareTo(rootB) < 0) {
            parent.put(rootB, rootA);
        } else {
            parent.put(rootA, rootB);
        }
    }

    /**
     * Connected components with at least two members, each sorted, ordered by first member.
     */
    public List<List<String>> groups() {
        Map<String, TreeSet<String>> byRoot = new TreeMap<>();
        for (String node : new ArrayList<>(parent.keySet())) {
            byRoot.computeIfAbsent(find(node), r -> new TreeSet<>()).add(node);
        }
        List<List<String>> groups = new ArrayList<>();
        for (TreeSet<String> members : byRoot.values()) {
            if (members.size() >= 2) {
                groups.add(new ArrayList<>(members));
            }
        }
        groups.sort(Comparator.comparing(g -> g.get(0)));
        return groups;
    }
}
