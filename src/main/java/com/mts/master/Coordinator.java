package com.mts.master;

import com.mts.common.config.MasterOptions;
import com.mts.common.model.ColumnSchema;
import com.mts.common.model.NodeInfo;
import com.mts.common.model.NodeState;
import com.mts.common.model.TableDetails;
import com.mts.common.model.TableSummary;
import com.mts.common.status.Result;
import com.mts.common.status.StatusCode;
import com.mts.master.catalog.CatalogSnapshot;
import com.mts.master.catalog.CatalogStore;
import com.mts.master.persist.CatalogPersistence;
import com.mts.master.placement.PlacementPolicies;
import com.mts.master.placement.PlacementPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Master 主流程：持有节点注册表和目录，负责生命周期以及节点失联后的副本补齐。
 * 目录写操作在独立线程池执行，调用方超时不会打断已提交的写入。
 */
public class Coordinator {
    private static final Logger logger = LoggerFactory.getLogger(Coordinator.class);

    private final MasterOptions options;
    private final CatalogPersistence persistence;
    private final PlacementPolicy placementPolicy;
    private final LongSupplier clock;

    private final Object lifecycleLock = new Object();
    private volatile MasterState state = MasterState.STOPPED;
    private volatile boolean healthy = true;

    private NodeRegistry nodeRegistry;
    private CatalogStore catalogStore;
    private ReplicaReassignmentPlanner planner;
    private ScheduledExecutorService sweepExecutor;
    private ExecutorService mutationExecutor;

    public Coordinator(MasterOptions options, CatalogPersistence persistence) {
        this(options, persistence, PlacementPolicies.fromName(options.getPlacementPolicy()), System::currentTimeMillis);
    }

    public Coordinator(MasterOptions options, CatalogPersistence persistence, PlacementPolicy placementPolicy,
            LongSupplier clock) {
        this.options = options;
        this.persistence = persistence;
        this.placementPolicy = placementPolicy;
        this.clock = clock;
    }

    /**
     * 恢复持久化目录。只能从 STOPPED 调用，目录损坏时抛出 CatalogRecoveryException。
     */
    public void init() {
        synchronized (lifecycleLock) {
            checkTransition(MasterState.INITIALIZED);
            logger.info("Master 初始化中, 放置策略: {}", placementPolicy.name());

            NodeRegistry registry = new NodeRegistry(clock);
            CatalogStore store = new CatalogStore(persistence, placementPolicy, clock);
            store.recover();    // 目录损坏时直接抛出，状态保持 STOPPED

            // 目录中引用但尚未发来心跳的节点，给一个超时周期的宽限
            registry.seedUnknown(store.snapshot().getReferencedNodeIds());

            this.nodeRegistry = registry;
            this.catalogStore = store;
            this.planner = new ReplicaReassignmentPlanner(placementPolicy);
            this.sweepExecutor = Executors.newSingleThreadScheduledExecutor(namedThreadFactory("master-sweep"));
            this.mutationExecutor = Executors.newFixedThreadPool(options.getMutationThreads(),
                    namedThreadFactory("catalog-mutation"));
            this.healthy = true;
            state = MasterState.INITIALIZED;
            logger.info("Master 初始化完成, 目录中共 {} 张表", store.snapshot().getLiveTableCount());
        }
    }

    // 只能从 INITIALIZED 调用
    public void start() {
        synchronized (lifecycleLock) {
            checkTransition(MasterState.RUNNING);
            long interval = options.getSweepIntervalMs();
            sweepExecutor.scheduleAtFixedRate(this::sweepSafely, interval, interval, TimeUnit.MILLISECONDS);
            state = MasterState.RUNNING;
            logger.info("Master 已启动, 心跳超时 {} ms, 检查周期 {} ms", options.getHeartbeatTimeoutMs(), interval);
        }
    }

    public void shutdown() {
        synchronized (lifecycleLock) {
            if (state == MasterState.STOPPED) {
                return;
            }
            logger.info("Master 正在关闭...");
            state = MasterState.STOPPED;    // 先拒绝新请求

            sweepExecutor.shutdown();       // 周期任务随之取消，正在执行的一轮跑完
            mutationExecutor.shutdown();
            long timeout = options.getShutdownTimeoutMs();
            try {
                if (!mutationExecutor.awaitTermination(timeout, TimeUnit.MILLISECONDS)) {
                    logger.warn("等待目录写操作完成超时 ({} ms)", timeout);
                    mutationExecutor.shutdownNow();
                }
                if (!sweepExecutor.awaitTermination(timeout, TimeUnit.MILLISECONDS)) {
                    logger.warn("等待后台检查任务结束超时 ({} ms)", timeout);
                }
            } catch (InterruptedException e) {
                mutationExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            logger.info("Master 已关闭");
        }
    }

    public Result<HeartbeatResponse> heartbeat(String nodeId, String host, int port, int reportedTabletCount,
            long sequence) {
        return heartbeat(nodeId, host, port, reportedTabletCount, sequence, Collections.emptyList());
    }

    /**
     * @param deletedTabletIds 节点已清理完数据的已删除 tablet，不再下发给它
     */
    public Result<HeartbeatResponse> heartbeat(String nodeId, String host, int port, int reportedTabletCount,
            long sequence, List<String> deletedTabletIds) {
        if (!isRunning()) {
            return notRunning();
        }
        Result<Boolean> recorded = nodeRegistry.recordHeartbeat(nodeId, host, port, reportedTabletCount, sequence);
        if (recorded.isFailure()) {
            return recorded.propagate();
        }
        if (recorded.getValue()) {
            scheduleReconcile();
        }
        if (deletedTabletIds != null && !deletedTabletIds.isEmpty()) {
            Result<Integer> acked = catalogStore.acknowledgeTabletDeletion(nodeId, deletedTabletIds);
            if (acked.isFailure()) {
                // 下次心跳会重新下发，节点重复删除是幂等的
                logger.warn("节点 {} 的清理确认未能记录: {}", nodeId, acked.getMessage());
            }
        }
        List<String> toDelete = catalogStore.snapshot().getDeletedTabletIdsHostedOn(nodeId);
        return Result.success(new HeartbeatResponse(recorded.getValue(), toDelete));
    }

    public Result<String> createTable(String tableName, List<ColumnSchema> columns, List<String> splitKeys,
            int replicationFactor, long timeoutMs) {
        return executeMutation("CreateTable " + tableName,
                () -> catalogStore.createTable(tableName, columns, splitKeys, replicationFactor,
                        nodeRegistry.listLiveNodes()),
                timeoutMs);
    }

    public Result<Void> deleteTable(String tableName, long timeoutMs) {
        return executeMutation("DeleteTable " + tableName, () -> catalogStore.deleteTable(tableName), timeoutMs);
    }

    public Result<Void> reassignReplicas(String tabletId, List<String> expectedReplicas, List<String> newReplicas,
            long timeoutMs) {
        return executeMutation("ReassignReplicas " + tabletId,
                () -> catalogStore.reassignReplicas(tabletId, expectedReplicas, newReplicas), timeoutMs);
    }

    public Result<Void> decommissionNode(String nodeId) {
        if (!isRunning()) {
            return notRunning();
        }
        Result<Void> result = nodeRegistry.decommission(nodeId);
        if (result.isSuccess()) {
            scheduleReconcile();
        }
        return result;
    }

    public Result<TableDetails> getTableInfo(String tableName) {
        if (!isRunning()) {
            return notRunning();
        }
        return catalogStore.getTableInfo(tableName);
    }

    public Result<List<TableSummary>> listTables() {
        if (!isRunning()) {
            return notRunning();
        }
        return Result.success(catalogStore.listTables());
    }

    public Result<List<NodeInfo>> listNodes() {
        if (!isRunning()) {
            return notRunning();
        }
        return Result.success(nodeRegistry.listNodes());
    }

    public MasterStatus status() {
        NodeRegistry registry = nodeRegistry;
        CatalogStore store = catalogStore;
        if (registry == null || store == null) {
            return new MasterStatus(state, healthy, 0, 0, 0);
        }
        return new MasterStatus(state, healthy, registry.liveNodeCount(), registry.listNodes().size(),
                store.snapshot().getLiveTableCount());
    }

    /** 一轮检查：标记失联节点，再补齐副本。返回成功提交的重分配数。 */
    public int runSweepCycle() {
        if (!isRunning()) {
            return 0;
        }
        Set<String> expired = nodeRegistry.sweepExpired(clock.getAsLong(), options.getHeartbeatTimeoutMs());
        if (!expired.isEmpty()) {
            logger.warn("本轮检查发现 {} 个节点失联: {}", expired.size(), expired);
        }
        return reconcile();
    }

    // 冲突或节点不足的方案直接丢弃，下一轮重试
    public int reconcile() {
        if (!isRunning()) {
            return 0;
        }
        CatalogSnapshot snapshot = catalogStore.snapshot();
        Set<String> failed = new HashSet<>(nodeRegistry.nodeIdsInState(NodeState.DEAD));
        for (String nodeId : snapshot.getReferencedNodeIds()) {
            if (!nodeRegistry.isKnown(nodeId)) {
                failed.add(nodeId);     // 已下线移除的节点
            }
        }

        Collection<NodeInfo> liveNodes = nodeRegistry.listLiveNodes();
        List<ReassignmentProposal> proposals = planner.plan(snapshot, liveNodes, failed);
        int applied = 0;
        for (ReassignmentProposal proposal : proposals) {
            Result<Void> result = catalogStore.reassignReplicas(proposal.getTabletId(),
                    proposal.getExpectedReplicas(), proposal.getProposedReplicas());
            switch (result.getCode()) {
                case OK:
                    applied++;
                    break;
                case CONFLICT:
                case UNAVAILABLE:
                case NOT_FOUND:
                    logger.debug("放弃本轮副本重分配 {}: {}", proposal, result.getMessage());
                    break;
                case INTERNAL:
                    markUnhealthy("副本重分配持久化失败: " + result.getMessage());
                    break;
                default:
                    logger.warn("副本重分配 {} 返回意外结果: {}", proposal, result);
            }
        }
        if (applied > 0) {
            logger.info("本轮完成 {} 个 tablet 的副本重分配", applied);
        }
        return applied;
    }

    private void scheduleReconcile() {
        ScheduledExecutorService executor = sweepExecutor;
        if (!isRunning() || executor == null) {
            return;
        }
        try {
            executor.execute(this::reconcileSafely);
        } catch (RejectedExecutionException e) {
            logger.debug("Master 正在关闭, 跳过重分配: {}", e.getMessage());
        }
    }

    private void sweepSafely() {
        try {
            runSweepCycle();
        } catch (RuntimeException e) {
            // 异常会终止周期任务，这里只记录并标记
            markUnhealthy("节点检查任务异常: " + e.getMessage());
            logger.error("节点检查任务异常", e);
        }
    }

    private void reconcileSafely() {
        try {
            reconcile();
        } catch (RuntimeException e) {
            markUnhealthy("副本重分配任务异常: " + e.getMessage());
            logger.error("副本重分配任务异常", e);
        }
    }

    private <T> Result<T> executeMutation(String description, Supplier<Result<T>> mutation, long timeoutMs) {
        if (!isRunning()) {
            return notRunning();
        }
        if (timeoutMs <= 0) {
            return Result.failure(StatusCode.DEADLINE_EXCEEDED, description + ": deadline already expired");
        }

        Future<Result<T>> future;
        try {
            future = mutationExecutor.submit(() -> {
                Result<T> result = mutation.get();
                if (result.getCode() == StatusCode.INTERNAL) {
                    markUnhealthy(description + " 失败: " + result.getMessage());
                }
                return result;
            });
        } catch (RejectedExecutionException e) {
            return Result.unavailable("Master is shutting down");
        }

        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // 不取消任务，已开始的提交继续执行
            logger.warn("{} 在 {} ms 内未完成, 返回超时", description, timeoutMs);
            return Result.failure(StatusCode.DEADLINE_EXCEEDED,
                    description + " did not complete within " + timeoutMs + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.unavailable(description + " interrupted");
        } catch (ExecutionException e) {
            markUnhealthy(description + " 异常: " + e.getCause());
            logger.error("{} 执行异常", description, e.getCause());
            return Result.failure(StatusCode.INTERNAL, description + " failed: " + e.getCause());
        }
    }

    private void markUnhealthy(String reason) {
        if (healthy) {
            logger.error("Master 标记为不健康: {}", reason);
        }
        healthy = false;
    }

    private void checkTransition(MasterState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Cannot move master from " + state + " to " + target);
        }
    }

    private <T> Result<T> notRunning() {
        return Result.unavailable("Master is not running (state " + state + ")");
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public boolean isRunning() {
        return state == MasterState.RUNNING;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public MasterState getState() {
        return state;
    }

    public MasterOptions getOptions() {
        return options;
    }

    public NodeRegistry nodeRegistry() {
        return nodeRegistry;
    }

    public CatalogStore catalogStore() {
        return catalogStore;
    }
}
