package com.mts.master;

import com.mts.common.model.NodeInfo;
import com.mts.common.model.NodeState;
import com.mts.common.status.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

/**
 * 存储节点注册表。同一节点的更新都经过 compute 串行执行，对外只返回副本。
 */
public class NodeRegistry {
    private static final Logger logger = LoggerFactory.getLogger(NodeRegistry.class);

    private final Map<String, NodeInfo> nodes = new ConcurrentHashMap<>();
    private final LongSupplier clock;

    public NodeRegistry(LongSupplier clock) {
        this.clock = clock;
    }

    /**
     * @param sequence 心跳逻辑时间戳，0 表示不检查顺序
     * @return 节点是否因这次心跳变为 LIVE（首次注册或从 DEAD/UNKNOWN 恢复）
     */
    public Result<Boolean> recordHeartbeat(String nodeId, String host, int port, int reportedTabletCount,
            long sequence) {
        if (nodeId == null || nodeId.trim().isEmpty()) {
            return Result.invalidArgument("Heartbeat is missing the node id");
        }
        if (host == null || host.trim().isEmpty()) {
            return Result.invalidArgument("Heartbeat from " + nodeId + " is missing the host");
        }
        if (port < 1 || port > 65535) {
            return Result.invalidArgument("Heartbeat from " + nodeId + " has invalid port " + port);
        }
        if (reportedTabletCount < 0) {
            return Result.invalidArgument("Heartbeat from " + nodeId + " reports negative load " + reportedTabletCount);
        }
        if (sequence < 0) {
            return Result.invalidArgument("Heartbeat from " + nodeId + " has negative sequence " + sequence);
        }

        long now = clock.getAsLong();
        AtomicBoolean becameLive = new AtomicBoolean(false);
        nodes.compute(nodeId, (id, existing) -> {
            if (existing != null && sequence > 0 && sequence < existing.getLastSequence()) {
                // 过期心跳，忽略
                logger.debug("忽略节点 {} 的过期心跳: sequence {} < {}", id, sequence, existing.getLastSequence());
                return existing;
            }
            // 总是替换为新对象，读者拿到的记录不会被原地修改
            NodeInfo node = existing == null ? new NodeInfo(id, host, port, now) : new NodeInfo(existing);
            node.setHost(host);
            node.setPort(port);
            node.setLastHeartbeat(now);
            node.setReportedTabletCount(reportedTabletCount);
            if (sequence > 0) {
                node.setLastSequence(sequence);
            }
            if (node.getState() != NodeState.LIVE) {
                logger.info("节点 {} ({}:{}) 状态 {} -> LIVE", id, host, port, node.getState());
                node.setState(NodeState.LIVE);
                becameLive.set(true);
            }
            return node;
        });
        return Result.success(becameLive.get());
    }

    /** LIVE 节点快照，按节点 ID 排序。 */
    public List<NodeInfo> listLiveNodes() {
        return nodes.values().stream()
                .filter(NodeInfo::isLive)
                .map(NodeInfo::new)
                .sorted(Comparator.comparing(NodeInfo::getNodeId))
                .collect(Collectors.toList());
    }

    public List<NodeInfo> listNodes() {
        return nodes.values().stream()
                .map(NodeInfo::new)
                .sorted(Comparator.comparing(NodeInfo::getNodeId))
                .collect(Collectors.toList());
    }

    public Optional<NodeInfo> getNode(String nodeId) {
        NodeInfo node = nodes.get(nodeId);
        return node == null ? Optional.empty() : Optional.of(new NodeInfo(node));
    }

    /** 超时未心跳的节点标记为 DEAD，返回本次发生变化的节点。 */
    public Set<String> sweepExpired(long now, long timeoutMs) {
        Set<String> expired = ConcurrentHashMap.newKeySet();
        for (String nodeId : nodes.keySet()) {
            nodes.computeIfPresent(nodeId, (id, node) -> {
                if (node.getState() == NodeState.DEAD || now - node.getLastHeartbeat() <= timeoutMs) {
                    return node;
                }
                logger.warn("节点 {} 已 {} ms 无心跳, 状态 {} -> DEAD",
                        id, now - node.getLastHeartbeat(), node.getState());
                NodeInfo dead = new NodeInfo(node);
                dead.setState(NodeState.DEAD);
                expired.add(id);
                return dead;
            });
        }
        return new HashSet<>(expired);
    }

    public Result<Void> decommission(String nodeId) {
        if (nodeId == null || nodeId.trim().isEmpty()) {
            return Result.invalidArgument("Node id must not be empty");
        }
        NodeInfo removed = nodes.remove(nodeId);
        if (removed == null) {
            return Result.notFound("Node not found: " + nodeId);
        }
        logger.info("节点 {} ({}) 已下线移除, 原状态 {}", nodeId, removed.getAddress(), removed.getState());
        return Result.ok();
    }

    // 只在目录中出现过的节点以 UNKNOWN 登记，给它们一个超时周期来上报
    public void seedUnknown(Collection<String> nodeIds) {
        long now = clock.getAsLong();
        for (String nodeId : nodeIds) {
            nodes.computeIfAbsent(nodeId, id -> {
                NodeInfo node = new NodeInfo(id, null, 0, now);
                node.setLastHeartbeat(now);
                return node;
            });
        }
        if (!nodeIds.isEmpty()) {
            logger.info("从目录中恢复 {} 个待确认节点: {}", nodeIds.size(), nodeIds);
        }
    }

    public Set<String> nodeIdsInState(NodeState state) {
        return nodes.values().stream()
                .filter(node -> node.getState() == state)
                .map(NodeInfo::getNodeId)
                .collect(Collectors.toSet());
    }

    public boolean isKnown(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public int liveNodeCount() {
        return (int) nodes.values().stream().filter(NodeInfo::isLive).count();
    }
}
