package com.knowledge.curation.community;

import com.knowledge.curation.core.model.Community;
import com.knowledge.curation.graph.GraphSnapshot;
import com.knowledge.curation.graph.SimilarityGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions a similarity graph into candidate duplicate groups.
 * Implementations must be deterministic for a fixed graph and configuration.
 */
public interface CommunityDetector {

    /**
     * Detects communities of size two or more in one category graph.
     */
    List<Community> detect(SimilarityGraph graph);

    /**
     * Detects communities in every category, in processing order.
     */
    default List<Community> detectAll(GraphSnapshot snapshot) {
        List<Community> all = new ArrayList<>();
        for (SimilarityGraph graph : snapshot.graphs().values()) {
            all.addAll(detect(graph));
        }
        all.sort(Community.PRIORITY_ORDER);
        return all;
    }
}
