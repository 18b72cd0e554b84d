package com.knowledge.curation.drift;

import com.knowledge.curation.graph.GraphSnapshot;
import com.knowledge.curation.graph.SimilarityGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finds drift triads in a similarity graph.
 * Each {A, B, C} is reported once, centered on B with {@code A < C}.
 */
public class DriftTriadDetector {
    private static final Logger log = LoggerFactory.getLogger(DriftTriadDetector.class);

    private final double highThreshold;

    public DriftTriadDetector(double highThreshold) {
        if (highThreshold < 0.0 || highThreshold > 1.0) {
            throw new IllegalArgumentException("highThreshold must be between 0.0 and 1.0");
        }
        this.highThreshold = highThreshold;
    }

    public List<DriftTriad> detect(GraphSnapshot snapshot) {
        List<DriftTriad> triads = new ArrayList<>();
        for (SimilarityGraph graph : snapshot.graphs().values()) {
            triads.addAll(detect(graph));
        }
        return triads;
    }

    public List<DriftTriad> detect(SimilarityGraph graph) {
        List<DriftTriad> triads = new ArrayList<>();
        for (String center : graph.nodes()) {
            List<Map.Entry<String, Double>> high = new ArrayList<>();
            graph.neighbors(center).forEach((other, edge) -> {
                if (edge.blendedScore() >= highThreshold) {
                    high.add(Map.entry(other, edge.blendedScore()));
                }
            });
            // neighbors() is ordered, so i < j gives a < c
            for (int i = 0; i < high.size(); i++) {
                for (int j = i + 1; j < high.size(); j++) {
                    String a = high.get(i).getKey();
                    String c = high.get(j).getKey();
                    double ac = graph.score(a, c);
                    if (ac < highThreshold) {
                        triads.add(new DriftTriad(graph.category(), a, center, c,
                                high.get(i).getValue(), high.get(j).getValue(), ac));
                    }
                }
            }
        }
        if (!triads.isEmpty()) {
            log.debug("drift.detected category={} triads={}", graph.category(), triads.size());
        }
        return triads;
    }

    public double getHighThreshold() {
        return highThreshold;
    }
}
