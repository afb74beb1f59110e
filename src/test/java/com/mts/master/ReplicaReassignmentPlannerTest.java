package com.mts.master;

import com.mts.common.model.ColumnSchema;
import com.mts.common.model.DataType;
import com.mts.common.model.NodeInfo;
import com.mts.common.model.NodeState;
import com.mts.common.model.TabletInfo;
import com.mts.master.catalog.CatalogSnapshot;
import com.mts.master.catalog.CatalogStore;
import com.mts.master.persist.InMemoryCatalogPersistence;
import com.mts.master.placement.LeastLoadedPlacementPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ReplicaReassignmentPlannerTest {
    private static final List<ColumnSchema> SCHEMA = List.of(new ColumnSchema("k", DataType.STRING, false));

    private CatalogStore store;
    private ReplicaReassignmentPlanner planner;

    @BeforeEach
    public void setUp() {
        store = new CatalogStore(new InMemoryCatalogPersistence(), new LeastLoadedPlacementPolicy(), () -> 0L);
        store.recover();
        planner = new ReplicaReassignmentPlanner(new LeastLoadedPlacementPolicy());
    }

    private static List<NodeInfo> nodes(String... ids) {
        List<NodeInfo> nodes = new ArrayList<>();
        for (String id : ids) {
            NodeInfo node = new NodeInfo(id, "host-" + id, 7050, 0);
            node.setState(NodeState.LIVE);
            nodes.add(node);
        }
        return nodes;
    }

    @Test
    public void testNothingToDoWithoutFailures() {
        store.createTable("t", SCHEMA, List.of("m"), 3, nodes("n1", "n2", "n3"));
        assertTrue(planner.plan(store.snapshot(), nodes("n1", "n2", "n3", "n4"), Set.of()).isEmpty());
    }

    @Test
    public void testReplacesFailedReplica() {
        store.createTable("t", SCHEMA, List.of("m"), 3, nodes("n1", "n2", "n3"));
        CatalogSnapshot snapshot = store.snapshot();

        List<ReassignmentProposal> proposals = planner.plan(snapshot, nodes("n2", "n3", "n4", "n5"), Set.of("n1"));

        assertEquals(2, proposals.size());
        Set<String> replacements = new HashSet<>();
        for (ReassignmentProposal proposal : proposals) {
            TabletInfo tablet = snapshot.getTablet(proposal.getTabletId()).orElseThrow();
            assertEquals(tablet.getReplicas(), proposal.getExpectedReplicas());

            List<String> proposed = proposal.getProposedReplicas();
            assertEquals(3, proposed.size());
            assertEquals(3, new HashSet<>(proposed).size());
            assertFalse(proposed.contains("n1"));
            // 存活副本保持原有顺序
            assertEquals(List.of("n2", "n3"), proposed.subList(0, 2));
            replacements.add(proposed.get(2));
        }
        // 负载在本轮内累加，两次替换落在不同节点
        assertEquals(Set.of("n4", "n5"), replacements);
    }

    @Test
    public void testUnaffectedTabletsAreLeftAlone() {
        store.createTable("a", SCHEMA, List.of(), 2, nodes("n1", "n2"));
        store.createTable("b", SCHEMA, List.of(), 2, nodes("n3", "n4"));

        List<ReassignmentProposal> proposals = planner.plan(store.snapshot(), nodes("n2", "n3", "n4", "n5"),
                Set.of("n1"));
        assertEquals(1, proposals.size());
        String tableA = store.getTableInfo("a").getValue().getTable().getTableId();
        assertEquals(tableA, proposals.get(0).getTableId());
    }

    @Test
    public void testSkipsTabletWithoutSurvivors() {
        store.createTable("t", SCHEMA, List.of(), 2, nodes("n1", "n2"));
        assertTrue(planner.plan(store.snapshot(), nodes("n3", "n4"), Set.of("n1", "n2")).isEmpty());
    }

    @Test
    public void testSkipsWhenNoCandidates() {
        store.createTable("t", SCHEMA, List.of(), 3, nodes("n1", "n2", "n3"));
        assertTrue(planner.plan(store.snapshot(), nodes("n2", "n3"), Set.of("n1")).isEmpty());
    }

    @Test
    public void testPartialImprovement() {
        store.createTable("t", SCHEMA, List.of(), 3, nodes("n1", "n2", "n3"));
        List<ReassignmentProposal> proposals = planner.plan(store.snapshot(), nodes("n3", "n4"), Set.of("n1", "n2"));

        assertEquals(1, proposals.size());
        assertEquals(List.of("n3", "n4"), proposals.get(0).getProposedReplicas());
    }

    @Test
    public void testTopsUpUnderReplicatedTabletWithoutFailures() {
        store.createTable("t", SCHEMA, List.of(), 3, nodes("n1", "n2", "n3"));
        TabletInfo tablet = store.snapshot().getLiveTablets().get(0);
        // 上一轮只补到两个副本
        assertTrue(store.reassignReplicas(tablet.getTabletId(), tablet.getReplicas(), List.of("n1", "n4"))
                .isSuccess());

        assertTrue(planner.plan(store.snapshot(), nodes("n1", "n4"), Set.of()).isEmpty());

        List<ReassignmentProposal> proposals = planner.plan(store.snapshot(), nodes("n1", "n4", "n5"), Set.of());
        assertEquals(1, proposals.size());
        assertEquals(List.of("n1", "n4"), proposals.get(0).getExpectedReplicas());
        assertEquals(List.of("n1", "n4", "n5"), proposals.get(0).getProposedReplicas());
    }

    @Test
    public void testDeletedTablesAreIgnored() {
        store.createTable("t", SCHEMA, List.of(), 2, nodes("n1", "n2"));
        store.deleteTable("t");
        assertTrue(planner.plan(store.snapshot(), nodes("n2", "n3"), Set.of("n1")).isEmpty());
    }

    @Test
    public void testPlanDoesNotTouchSnapshot() {
        store.createTable("t", SCHEMA, List.of("m"), 2, nodes("n1", "n2"));
        CatalogSnapshot snapshot = store.snapshot();
        List<List<String>> before = snapshot.getAllTablets().stream()
                .map(TabletInfo::getReplicas).collect(Collectors.toList());

        planner.plan(snapshot, nodes("n2", "n3"), Set.of("n1"));

        List<List<String>> after = snapshot.getAllTablets().stream()
                .map(TabletInfo::getReplicas).collect(Collectors.toList());
        assertEquals(before, after);
        assertSame(snapshot, store.snapshot());
    }
}
