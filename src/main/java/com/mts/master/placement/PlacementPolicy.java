package com.mts.master.placement;

import com.mts.common.model.NodeInfo;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Chooses which live nodes receive new tablet replicas.
 */
public interface PlacementPolicy {

    /**
     * Picks up to {@code count} distinct node ids from {@code candidates}.
     *
     * @param count      number of replicas wanted
     * @param candidates live nodes to choose from
     * @param excluded   node ids that must not be chosen (e.g. replicas already in the set)
     * @param loads      current replica load per node id; missing entries count as zero
     * @return chosen node ids in placement order; fewer than {@code count} if there are not enough candidates
     */
    List<String> selectReplicas(int count, Collection<NodeInfo> candidates, Set<String> excluded,
            Map<String, Integer> loads);

    String name();
}
