package com.mts.master;

import com.mts.common.model.NodeInfo;
import com.mts.common.model.TableInfo;
import com.mts.common.model.TabletInfo;
import com.mts.master.catalog.CatalogSnapshot;
import com.mts.master.placement.PlacementPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 计算副本重分配方案：副本落在失效节点上，或副本数低于副本因子的 tablet 都会补齐。
 * 只读参数，返回的方案由调用方以乐观并发方式提交。
 */
public class ReplicaReassignmentPlanner {
    private static final Logger logger = LoggerFactory.getLogger(ReplicaReassignmentPlanner.class);

    private final PlacementPolicy placementPolicy;

    public ReplicaReassignmentPlanner(PlacementPolicy placementPolicy) {
        this.placementPolicy = placementPolicy;
    }

    public List<ReassignmentProposal> plan(CatalogSnapshot snapshot, Collection<NodeInfo> liveNodes,
            Set<String> failedNodeIds) {
        List<ReassignmentProposal> proposals = new ArrayList<>();
        Map<String, Integer> loads = new HashMap<>(snapshot.getReplicaCountsByNode());

        for (TabletInfo tablet : snapshot.getLiveTablets()) {
            Optional<TableInfo> table = snapshot.getTable(tablet.getTableId());
            if (table.isEmpty()) {
                continue;
            }
            int replicationFactor = table.get().getReplicationFactor();
            List<String> current = tablet.getReplicas();
            boolean touchesFailed = current.stream().anyMatch(failedNodeIds::contains);
            if (!touchesFailed && current.size() >= replicationFactor) {
                continue;
            }

            List<String> survivors = current.stream()
                    .filter(nodeId -> !failedNodeIds.contains(nodeId))
                    .collect(Collectors.toList());
            if (survivors.isEmpty()) {
                // 没有存活副本可以复制数据
                logger.warn("tablet {} 的所有副本 {} 均已失效, 无法重新分配", tablet.getTabletId(), current);
                continue;
            }

            int needed = replicationFactor - survivors.size();
            List<String> replacements = new ArrayList<>();
            if (needed > 0) {
                Set<String> excluded = new HashSet<>(current);
                replacements = placementPolicy.selectReplicas(needed, liveNodes, excluded, loads);
                if (replacements.isEmpty()) {
                    logger.debug("tablet {} 副本不足但没有可用节点, 等待下一轮", tablet.getTabletId());
                    continue;
                }
                replacements.forEach(nodeId -> loads.merge(nodeId, 1, Integer::sum));
            }

            List<String> proposed = new ArrayList<>(survivors);
            proposed.addAll(replacements);
            proposals.add(new ReassignmentProposal(tablet.getTabletId(), tablet.getTableId(), current, proposed));
        }
        return proposals;
    }
}
