package com.mts.master;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mts.common.config.MasterOptions;
import com.mts.common.model.ColumnSchema;
import com.mts.common.model.DataType;
import com.mts.common.model.NodeInfo;
import com.mts.common.model.NodeState;
import com.mts.common.model.TabletInfo;
import com.mts.common.status.Result;
import com.mts.common.status.StatusCode;
import com.mts.master.catalog.CatalogRecoveryException;
import com.mts.master.persist.InMemoryCatalogPersistence;
import com.mts.master.persist.PersistenceException;
import com.mts.master.placement.LeastLoadedPlacementPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

public class CoordinatorTest {
    private static final long TIMEOUT = 1000;
    private static final long RPC_TIMEOUT = 5000;
    private static final List<ColumnSchema> SCHEMA = List.of(new ColumnSchema("id", DataType.INT64, false));

    private ControllablePersistence persistence;
    private ManualClock clock;
    private MasterOptions options;
    private Coordinator coordinator;

    /** 提交可以被阻塞或注入失败的内存存储。 */
    static class ControllablePersistence extends InMemoryCatalogPersistence {
        volatile boolean failCommits;
        volatile CountDownLatch gate;
        final CountDownLatch commitStarted = new CountDownLatch(1);

        @Override
        public void atomicCommit(Map<String, byte[]> writes) throws PersistenceException {
            if (failCommits) {
                throw new PersistenceException("injected commit failure");
            }
            CountDownLatch current = gate;
            if (current != null) {
                commitStarted.countDown();
                try {
                    current.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PersistenceException("interrupted", e);
                }
            }
            super.atomicCommit(writes);
        }
    }

    @BeforeEach
    public void setUp() {
        persistence = new ControllablePersistence();
        clock = new ManualClock(100_000);
        // 周期检查设得足够长，测试里手动触发
        options = MasterOptions.builderWithoutFile()
                .heartbeatTimeoutMs(TIMEOUT)
                .sweepIntervalMs(3_600_000)
                .shutdownTimeoutMs(10_000)
                .build();
        coordinator = new Coordinator(options, persistence, new LeastLoadedPlacementPolicy(), clock);
    }

    @AfterEach
    public void tearDown() {
        coordinator.shutdown();
    }

    private void startWithNodes(int count) {
        coordinator.init();
        coordinator.start();
        heartbeatAll(count, null);
    }

    private void heartbeatAll(int count, String except) {
        for (int i = 1; i <= count; i++) {
            String nodeId = "ts-" + i;
            if (!nodeId.equals(except)) {
                assertTrue(coordinator.heartbeat(nodeId, "10.0.0." + i, 7050, 0, 0).isSuccess());
            }
        }
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not reached in time");
            }
            Thread.sleep(20);
        }
    }

    @Test
    public void testLifecycleTransitions() {
        assertEquals(MasterState.STOPPED, coordinator.getState());
        assertThrows(IllegalStateException.class, coordinator::start);

        coordinator.init();
        assertEquals(MasterState.INITIALIZED, coordinator.getState());
        assertThrows(IllegalStateException.class, coordinator::init);

        coordinator.start();
        assertEquals(MasterState.RUNNING, coordinator.getState());
        assertThrows(IllegalStateException.class, coordinator::start);
        assertThrows(IllegalStateException.class, coordinator::init);

        coordinator.shutdown();
        assertEquals(MasterState.STOPPED, coordinator.getState());
        coordinator.shutdown();
        assertEquals(MasterState.STOPPED, coordinator.getState());
        assertThrows(IllegalStateException.class, coordinator::start);

        // 关闭后可以重新初始化
        coordinator.init();
        coordinator.start();
        assertTrue(coordinator.isRunning());
    }

    @Test
    public void testShutdownFromInitialized() {
        coordinator.init();
        coordinator.shutdown();
        assertEquals(MasterState.STOPPED, coordinator.getState());
    }

    @Test
    public void testRequestsRejectedUnlessRunning() {
        assertEquals(StatusCode.UNAVAILABLE, coordinator.heartbeat("ts-1", "h", 7050, 0, 0).getCode());
        coordinator.init();
        assertEquals(StatusCode.UNAVAILABLE,
                coordinator.createTable("t", SCHEMA, List.of(), 1, RPC_TIMEOUT).getCode());
        assertEquals(StatusCode.UNAVAILABLE, coordinator.listTables().getCode());
        coordinator.start();
        coordinator.shutdown();
        assertEquals(StatusCode.UNAVAILABLE, coordinator.getTableInfo("t").getCode());
        assertEquals(StatusCode.UNAVAILABLE, coordinator.deleteTable("t", RPC_TIMEOUT).getCode());
    }

    @Test
    public void testInitFailsOnCorruptCatalog() throws Exception {
        TabletInfo orphan = new TabletInfo("orphan", "no-table", "", "", List.of("ts-1"));
        persistence.atomicCommit(Map.of("tablets/orphan", new ObjectMapper().writeValueAsBytes(orphan)));

        assertThrows(CatalogRecoveryException.class, coordinator::init);
        assertEquals(MasterState.STOPPED, coordinator.getState());
    }

    @Test
    public void testHeartbeatReportsNewNode() {
        coordinator.init();
        coordinator.start();
        assertTrue(coordinator.heartbeat("ts-1", "h", 7050, 0, 0).getValue().isNewNode());
        assertFalse(coordinator.heartbeat("ts-1", "h", 7050, 0, 0).getValue().isNewNode());
        assertEquals(StatusCode.INVALID_ARGUMENT, coordinator.heartbeat("ts-2", null, 7050, 0, 0).getCode());
    }

    @Test
    public void testSweepRestoresReplicationFactor() {
        startWithNodes(6);
        assertTrue(coordinator.createTable("t", SCHEMA, List.of(), 3, RPC_TIMEOUT).isSuccess());
        TabletInfo tablet = coordinator.getTableInfo("t").getValue().getTablets().get(0);
        String victim = tablet.getReplicas().get(0);

        clock.advance(TIMEOUT + 1);
        heartbeatAll(6, victim);
        coordinator.runSweepCycle();

        assertEquals(NodeState.DEAD, coordinator.nodeRegistry().getNode(victim).orElseThrow().getState());
        TabletInfo repaired = coordinator.getTableInfo("t").getValue().getTablets().get(0);
        assertEquals(3, repaired.getReplicas().size());
        assertEquals(3, new HashSet<>(repaired.getReplicas()).size());
        assertFalse(repaired.getReplicas().contains(victim));
        for (String nodeId : repaired.getReplicas()) {
            assertTrue(coordinator.nodeRegistry().getNode(nodeId).orElseThrow().isLive());
        }
        assertNotEquals(victim, repaired.getLeaderHint());
        assertTrue(coordinator.isHealthy());
    }

    @Test
    public void testDecommissionTriggersReassignment() throws Exception {
        startWithNodes(4);
        coordinator.createTable("t", SCHEMA, List.of(), 3, RPC_TIMEOUT);
        String victim = coordinator.getTableInfo("t").getValue().getTablets().get(0).getReplicas().get(1);

        assertTrue(coordinator.decommissionNode(victim).isSuccess());
        assertEquals(StatusCode.NOT_FOUND, coordinator.decommissionNode(victim).getCode());

        awaitCondition(() -> !coordinator.getTableInfo("t").getValue().getTablets().get(0)
                .getReplicas().contains(victim));
        assertEquals(3, coordinator.getTableInfo("t").getValue().getTablets().get(0).getReplicas().size());
    }

    @Test
    public void testReturningNodeTriggersReconcile() throws Exception {
        startWithNodes(3);
        coordinator.createTable("t", SCHEMA, List.of(), 3, RPC_TIMEOUT);

        // ts-1 失联，只有三个节点时无法补副本
        clock.advance(TIMEOUT + 1);
        heartbeatAll(3, "ts-1");
        coordinator.runSweepCycle();
        assertTrue(coordinator.getTableInfo("t").getValue().getTablets().get(0).getReplicas().contains("ts-1"));

        // 新节点上线后由心跳触发重分配
        assertTrue(coordinator.heartbeat("ts-4", "10.0.0.4", 7050, 0, 0).getValue().isNewNode());
        awaitCondition(() -> coordinator.getTableInfo("t").getValue().getTablets().get(0)
                .getReplicas().contains("ts-4"));
        assertFalse(coordinator.getTableInfo("t").getValue().getTablets().get(0).getReplicas().contains("ts-1"));
    }

    @Test
    public void testPartiallyHealedTabletIsToppedUpLater() throws Exception {
        startWithNodes(4);
        coordinator.createTable("t", SCHEMA, List.of(), 3, RPC_TIMEOUT);
        assertEquals(List.of("ts-1", "ts-2", "ts-3"),
                coordinator.getTableInfo("t").getValue().getTablets().get(0).getReplicas());

        // ts-2、ts-3 同时失联，只剩 ts-4 可补
        clock.advance(TIMEOUT + 1);
        coordinator.heartbeat("ts-1", "10.0.0.1", 7050, 0, 0);
        coordinator.heartbeat("ts-4", "10.0.0.4", 7050, 0, 0);
        coordinator.runSweepCycle();
        assertEquals(List.of("ts-1", "ts-4"),
                coordinator.getTableInfo("t").getValue().getTablets().get(0).getReplicas());

        // 新节点加入后补齐到三副本
        assertTrue(coordinator.heartbeat("ts-5", "10.0.0.5", 7050, 0, 0).getValue().isNewNode());
        coordinator.runSweepCycle();
        awaitCondition(() -> coordinator.getTableInfo("t").getValue().getTablets().get(0)
                .getReplicas().size() == 3);
        assertEquals(List.of("ts-1", "ts-4", "ts-5"),
                coordinator.getTableInfo("t").getValue().getTablets().get(0).getReplicas());
    }

    @Test
    public void testRestartSeedsReferencedNodesAsUnknown() {
        startWithNodes(4);
        coordinator.createTable("t", SCHEMA, List.of(), 3, RPC_TIMEOUT);
        List<String> replicas = coordinator.getTableInfo("t").getValue().getTablets().get(0).getReplicas();
        coordinator.shutdown();

        Coordinator restarted = new Coordinator(options, persistence, new LeastLoadedPlacementPolicy(), clock);
        try {
            restarted.init();
            restarted.start();
            assertEquals(new HashSet<>(replicas), restarted.nodeRegistry().nodeIdsInState(NodeState.UNKNOWN));

            // 宽限期内不做重分配
            restarted.heartbeat("ts-4", "10.0.0.4", 7050, 0, 0);
            assertEquals(0, restarted.runSweepCycle());
            assertEquals(replicas, restarted.getTableInfo("t").getValue().getTablets().get(0).getReplicas());

            // 只有 replicas[1], replicas[2] 回来
            clock.advance(TIMEOUT / 2);
            restarted.heartbeat(replicas.get(1), "h", 7050, 0, 0);
            restarted.heartbeat(replicas.get(2), "h", 7050, 0, 0);
            restarted.heartbeat("ts-4", "10.0.0.4", 7050, 0, 0);
            clock.advance(TIMEOUT / 2 + 1);
            restarted.runSweepCycle();

            List<String> repaired = restarted.getTableInfo("t").getValue().getTablets().get(0).getReplicas();
            assertFalse(repaired.contains(replicas.get(0)));
            assertTrue(repaired.contains("ts-4"));
            assertEquals(3, repaired.size());
        } finally {
            restarted.shutdown();
        }
    }

    @Test
    public void testDeadlineExceededWhileCommitContinues() throws Exception {
        startWithNodes(1);
        persistence.gate = new CountDownLatch(1);

        Result<String> result = coordinator.createTable("slow", SCHEMA, List.of(), 1, 200);
        assertEquals(StatusCode.DEADLINE_EXCEEDED, result.getCode());

        // 放行后提交照常完成
        persistence.gate.countDown();
        awaitCondition(() -> coordinator.getTableInfo("slow").isSuccess());
        assertTrue(coordinator.isHealthy());
    }

    @Test
    public void testExpiredDeadlineIsRejectedUpFront() {
        startWithNodes(1);
        Result<String> result = coordinator.createTable("late", SCHEMA, List.of(), 1, 0);
        assertEquals(StatusCode.DEADLINE_EXCEEDED, result.getCode());
        assertEquals(0, persistence.size());
    }

    @Test
    public void testShutdownWaitsForInFlightMutation() throws Exception {
        startWithNodes(1);
        persistence.gate = new CountDownLatch(1);
        CompletableFuture<Result<String>> create = CompletableFuture.supplyAsync(
                () -> coordinator.createTable("t", SCHEMA, List.of(), 1, RPC_TIMEOUT));
        assertTrue(persistence.commitStarted.await(5, TimeUnit.SECONDS));

        CompletableFuture<Void> shutdown = CompletableFuture.runAsync(coordinator::shutdown);
        Thread.sleep(200);
        assertFalse(shutdown.isDone());

        persistence.gate.countDown();
        shutdown.get(10, TimeUnit.SECONDS);
        assertTrue(create.get(10, TimeUnit.SECONDS).isSuccess());
        assertTrue(persistence.size() > 0);
    }

    @Test
    public void testPersistenceFailureMarksUnhealthy() {
        startWithNodes(1);
        persistence.failCommits = true;

        Result<String> result = coordinator.createTable("t", SCHEMA, List.of(), 1, RPC_TIMEOUT);
        assertEquals(StatusCode.INTERNAL, result.getCode());
        assertFalse(coordinator.isHealthy());
        assertFalse(coordinator.status().isHealthy());
        assertTrue(coordinator.isRunning());
    }

    @Test
    public void testReconcileFailureMarksUnhealthy() {
        startWithNodes(4);
        coordinator.createTable("t", SCHEMA, List.of(), 3, RPC_TIMEOUT);
        String victim = coordinator.getTableInfo("t").getValue().getTablets().get(0).getReplicas().get(0);

        persistence.failCommits = true;
        clock.advance(TIMEOUT + 1);
        heartbeatAll(4, victim);
        assertEquals(0, coordinator.runSweepCycle());
        assertFalse(coordinator.isHealthy());
        assertTrue(coordinator.getTableInfo("t").getValue().getTablets().get(0).getReplicas().contains(victim));
    }

    @Test
    public void testHeartbeatCarriesDeletionIntents() {
        startWithNodes(2);
        coordinator.createTable("t", SCHEMA, List.of("m"), 2, RPC_TIMEOUT);
        assertTrue(coordinator.heartbeat("ts-1", "10.0.0.1", 7050, 2, 0).getValue().getTabletsToDelete().isEmpty());

        assertTrue(coordinator.deleteTable("t", RPC_TIMEOUT).isSuccess());
        HeartbeatResponse response = coordinator.heartbeat("ts-1", "10.0.0.1", 7050, 2, 0).getValue();
        assertEquals(2, response.getTabletsToDelete().size());

        // 节点确认清理后不再收到这些删除指令
        List<String> cleaned = response.getTabletsToDelete();
        assertTrue(coordinator.heartbeat("ts-1", "10.0.0.1", 7050, 0, 0, cleaned).getValue()
                .getTabletsToDelete().isEmpty());
        assertTrue(coordinator.heartbeat("ts-1", "10.0.0.1", 7050, 0, 0).getValue().getTabletsToDelete().isEmpty());
        assertEquals(2, coordinator.heartbeat("ts-2", "10.0.0.2", 7050, 2, 0).getValue()
                .getTabletsToDelete().size());
    }

    @Test
    public void testReassignThroughCoordinator() {
        startWithNodes(3);
        coordinator.createTable("t", SCHEMA, List.of(), 2, RPC_TIMEOUT);
        TabletInfo tablet = coordinator.getTableInfo("t").getValue().getTablets().get(0);

        assertEquals(StatusCode.CONFLICT, coordinator.reassignReplicas(tablet.getTabletId(),
                List.of("ts-3"), List.of("ts-3", "ts-1"), RPC_TIMEOUT).getCode());
        assertTrue(coordinator.reassignReplicas(tablet.getTabletId(), tablet.getReplicas(),
                List.of("ts-3", "ts-1"), RPC_TIMEOUT).isSuccess());
    }

    @Test
    public void testStatus() {
        assertEquals(MasterState.STOPPED, coordinator.status().getState());
        startWithNodes(2);
        coordinator.createTable("t", SCHEMA, List.of(), 1, RPC_TIMEOUT);

        MasterStatus status = coordinator.status();
        assertEquals(MasterState.RUNNING, status.getState());
        assertEquals(2, status.getLiveNodes());
        assertEquals(2, status.getTotalNodes());
        assertEquals(1, status.getTableCount());
        assertTrue(status.isHealthy());
        List<NodeInfo> nodes = coordinator.listNodes().getValue();
        assertEquals(2, nodes.size());
    }

    @Test
    public void testBackgroundSweepExpiresNodes() throws Exception {
        MasterOptions fast = MasterOptions.builderWithoutFile()
                .heartbeatTimeoutMs(200)
                .sweepIntervalMs(50)
                .build();
        Coordinator live = new Coordinator(fast, new InMemoryCatalogPersistence(), new LeastLoadedPlacementPolicy(),
                System::currentTimeMillis);
        try {
            live.init();
            live.start();
            live.heartbeat("ts-1", "h", 7050, 0, 0);
            awaitCondition(() -> live.nodeRegistry().getNode("ts-1").orElseThrow().getState() == NodeState.DEAD);
        } finally {
            live.shutdown();
        }
    }
}
