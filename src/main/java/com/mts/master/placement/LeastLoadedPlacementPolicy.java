package com.mts.master.placement;

import com.mts.common.config.SystemConfig;
import com.mts.common.model.NodeInfo;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 选择负载最低的节点；负载相同时按节点 ID 升序。
 * 节点负载取上报的 tablet 数与目录中已分配副本数的较大值。
 */
public class LeastLoadedPlacementPolicy implements PlacementPolicy {

    @Override
    public List<String> selectReplicas(int count, Collection<NodeInfo> candidates, Set<String> excluded,
            Map<String, Integer> loads) {
        return candidates.stream()
                .filter(node -> !excluded.contains(node.getNodeId()))
                .sorted(Comparator.comparingInt((NodeInfo node) -> effectiveLoad(node, loads))
                        .thenComparing(NodeInfo::getNodeId))
                .limit(Math.max(count, 0))
                .map(NodeInfo::getNodeId)
                .collect(Collectors.toList());
    }

    private static int effectiveLoad(NodeInfo node, Map<String, Integer> loads) {
        return Math.max(node.getReportedTabletCount(), loads.getOrDefault(node.getNodeId(), 0));
    }

    @Override
    public String name() {
        return SystemConfig.PLACEMENT_LEAST_LOADED;
    }
}
