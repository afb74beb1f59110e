package com.mts.master.placement;

import com.mts.common.config.SystemConfig;
import com.mts.common.model.NodeInfo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 按节点 ID 排序后轮询选择，忽略负载。
 */
public class RoundRobinPlacementPolicy implements PlacementPolicy {
    private final AtomicInteger cursor = new AtomicInteger();

    @Override
    public List<String> selectReplicas(int count, Collection<NodeInfo> candidates, Set<String> excluded,
            Map<String, Integer> loads) {
        List<String> ordered = candidates.stream()
                .map(NodeInfo::getNodeId)
                .filter(id -> !excluded.contains(id))
                .sorted(Comparator.naturalOrder())
                .collect(Collectors.toList());
        List<String> selected = new ArrayList<>();
        if (ordered.isEmpty() || count <= 0) {
            return selected;
        }
        int start = Math.floorMod(cursor.getAndIncrement(), ordered.size());
        for (int i = 0; i < ordered.size() && selected.size() < count; i++) {
            selected.add(ordered.get((start + i) % ordered.size()));
        }
        return selected;
    }

    @Override
    public String name() {
        return SystemConfig.PLACEMENT_ROUND_ROBIN;
    }
}
