package com.mts.master;

import com.mts.common.model.NodeInfo;
import com.mts.common.model.NodeState;
import com.mts.common.status.Result;
import com.mts.common.status.StatusCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class NodeRegistryTest {
    private static final long TIMEOUT = 1000;

    private ManualClock clock;
    private NodeRegistry registry;

    @BeforeEach
    public void setUp() {
        clock = new ManualClock(10_000);
        registry = new NodeRegistry(clock);
    }

    @Test
    public void testFirstHeartbeatRegistersLiveNode() {
        Result<Boolean> result = registry.recordHeartbeat("ts-1", "10.0.0.1", 7050, 3, 0);
        assertTrue(result.isSuccess());
        assertTrue(result.getValue());

        NodeInfo node = registry.getNode("ts-1").orElseThrow();
        assertEquals(NodeState.LIVE, node.getState());
        assertEquals("10.0.0.1:7050", node.getAddress());
        assertEquals(3, node.getReportedTabletCount());
        assertEquals(10_000, node.getLastHeartbeat());
        assertEquals(1, registry.listLiveNodes().size());
    }

    @Test
    public void testRepeatedHeartbeatIsNotNew() {
        registry.recordHeartbeat("ts-1", "10.0.0.1", 7050, 0, 0);
        clock.advance(100);
        Result<Boolean> result = registry.recordHeartbeat("ts-1", "10.0.0.1", 7050, 5, 0);

        assertFalse(result.getValue());
        assertEquals(10_100, registry.getNode("ts-1").orElseThrow().getLastHeartbeat());
        assertEquals(5, registry.getNode("ts-1").orElseThrow().getReportedTabletCount());
    }

    @Test
    public void testMalformedHeartbeatsAreRejectedWithoutState() {
        assertEquals(StatusCode.INVALID_ARGUMENT, registry.recordHeartbeat("", "h", 7050, 0, 0).getCode());
        assertEquals(StatusCode.INVALID_ARGUMENT, registry.recordHeartbeat(null, "h", 7050, 0, 0).getCode());
        assertEquals(StatusCode.INVALID_ARGUMENT, registry.recordHeartbeat("ts-1", null, 7050, 0, 0).getCode());
        assertEquals(StatusCode.INVALID_ARGUMENT, registry.recordHeartbeat("ts-1", " ", 7050, 0, 0).getCode());
        assertEquals(StatusCode.INVALID_ARGUMENT, registry.recordHeartbeat("ts-1", "h", 0, 0, 0).getCode());
        assertEquals(StatusCode.INVALID_ARGUMENT, registry.recordHeartbeat("ts-1", "h", 70000, 0, 0).getCode());
        assertEquals(StatusCode.INVALID_ARGUMENT, registry.recordHeartbeat("ts-1", "h", 7050, -1, 0).getCode());
        assertTrue(registry.listNodes().isEmpty());
    }

    @Test
    public void testSweepMarksSilentNodesDead() {
        registry.recordHeartbeat("ts-1", "h1", 7050, 0, 0);
        registry.recordHeartbeat("ts-2", "h2", 7050, 0, 0);
        clock.advance(600);
        registry.recordHeartbeat("ts-2", "h2", 7050, 0, 0);
        clock.advance(500);

        Set<String> dead = registry.sweepExpired(clock.getAsLong(), TIMEOUT);
        assertEquals(Set.of("ts-1"), dead);
        assertEquals(NodeState.DEAD, registry.getNode("ts-1").orElseThrow().getState());
        assertEquals(NodeState.LIVE, registry.getNode("ts-2").orElseThrow().getState());

        // 已经是 DEAD 的节点不会重复返回
        assertTrue(registry.sweepExpired(clock.getAsLong(), TIMEOUT).isEmpty());
    }

    @Test
    public void testSweepBoundaryIsStrict() {
        registry.recordHeartbeat("ts-1", "h1", 7050, 0, 0);
        clock.advance(TIMEOUT);
        assertTrue(registry.sweepExpired(clock.getAsLong(), TIMEOUT).isEmpty());
        clock.advance(1);
        assertEquals(Set.of("ts-1"), registry.sweepExpired(clock.getAsLong(), TIMEOUT));
    }

    @Test
    public void testDeadNodeComesBackLive() {
        registry.recordHeartbeat("ts-1", "h1", 7050, 0, 0);
        clock.advance(TIMEOUT + 1);
        registry.sweepExpired(clock.getAsLong(), TIMEOUT);

        Result<Boolean> result = registry.recordHeartbeat("ts-1", "h1", 7051, 0, 0);
        assertTrue(result.getValue());
        assertEquals(NodeState.LIVE, registry.getNode("ts-1").orElseThrow().getState());
        assertEquals(7051, registry.getNode("ts-1").orElseThrow().getPort());
    }

    @Test
    public void testStaleSequenceIsIgnored() {
        registry.recordHeartbeat("ts-1", "h1", 7050, 4, 5);
        clock.advance(100);
        Result<Boolean> stale = registry.recordHeartbeat("ts-1", "h1", 7050, 9, 3);

        assertTrue(stale.isSuccess());
        assertFalse(stale.getValue());
        NodeInfo node = registry.getNode("ts-1").orElseThrow();
        assertEquals(4, node.getReportedTabletCount());
        assertEquals(10_000, node.getLastHeartbeat());
        assertEquals(5, node.getLastSequence());

        // 未带序号的心跳总是生效
        registry.recordHeartbeat("ts-1", "h1", 7050, 7, 0);
        assertEquals(7, registry.getNode("ts-1").orElseThrow().getReportedTabletCount());
        assertEquals(5, registry.getNode("ts-1").orElseThrow().getLastSequence());
    }

    @Test
    public void testStaleSequenceDoesNotReviveDeadNode() {
        registry.recordHeartbeat("ts-1", "h1", 7050, 0, 5);
        clock.advance(TIMEOUT + 1);
        registry.sweepExpired(clock.getAsLong(), TIMEOUT);

        assertFalse(registry.recordHeartbeat("ts-1", "h1", 7050, 0, 4).getValue());
        assertEquals(NodeState.DEAD, registry.getNode("ts-1").orElseThrow().getState());
        assertTrue(registry.recordHeartbeat("ts-1", "h1", 7050, 0, 6).getValue());
    }

    @Test
    public void testSeededUnknownNodes() {
        registry.recordHeartbeat("ts-1", "h1", 7050, 0, 0);
        registry.seedUnknown(List.of("ts-1", "ts-2", "ts-3"));

        assertEquals(NodeState.LIVE, registry.getNode("ts-1").orElseThrow().getState());
        assertEquals(Set.of("ts-2", "ts-3"), registry.nodeIdsInState(NodeState.UNKNOWN));
        assertEquals(1, registry.listLiveNodes().size());

        clock.advance(500);
        assertTrue(registry.recordHeartbeat("ts-2", "h2", 7050, 0, 0).getValue());

        clock.advance(TIMEOUT);
        Set<String> dead = registry.sweepExpired(clock.getAsLong(), TIMEOUT);
        assertEquals(Set.of("ts-1", "ts-3"), dead);
    }

    @Test
    public void testDecommission() {
        registry.recordHeartbeat("ts-1", "h1", 7050, 0, 0);
        assertTrue(registry.decommission("ts-1").isSuccess());
        assertFalse(registry.isKnown("ts-1"));
        assertEquals(StatusCode.NOT_FOUND, registry.decommission("ts-1").getCode());

        // 重新上报即重新注册
        assertTrue(registry.recordHeartbeat("ts-1", "h1", 7050, 0, 0).getValue());
    }

    @Test
    public void testReturnedNodesAreCopies() {
        registry.recordHeartbeat("ts-1", "h1", 7050, 0, 0);
        registry.listNodes().get(0).setState(NodeState.DEAD);
        registry.getNode("ts-1").orElseThrow().setReportedTabletCount(99);

        NodeInfo node = registry.getNode("ts-1").orElseThrow();
        assertEquals(NodeState.LIVE, node.getState());
        assertEquals(0, node.getReportedTabletCount());
    }

    @Test
    public void testLivenessMatchesLastHeartbeatWithinTimeout() {
        Random random = new Random(42);
        Map<String, Long> lastSeen = new HashMap<>();
        for (int step = 0; step < 500; step++) {
            String nodeId = "ts-" + random.nextInt(6);
            if (random.nextInt(3) == 0) {
                registry.recordHeartbeat(nodeId, "host", 7050, 0, 0);
                lastSeen.put(nodeId, clock.getAsLong());
            }
            clock.advance(random.nextInt(400));
            registry.sweepExpired(clock.getAsLong(), TIMEOUT);

            for (Map.Entry<String, Long> entry : lastSeen.entrySet()) {
                boolean expectedLive = clock.getAsLong() - entry.getValue() <= TIMEOUT;
                NodeState state = registry.getNode(entry.getKey()).orElseThrow().getState();
                assertEquals(expectedLive, state == NodeState.LIVE, "step " + step + " node " + entry.getKey());
            }
        }
    }
}
