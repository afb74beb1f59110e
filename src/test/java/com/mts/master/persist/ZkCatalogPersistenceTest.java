package com.mts.master.persist;

import com.mts.common.model.ColumnSchema;
import com.mts.common.model.DataType;
import com.mts.common.model.NodeInfo;
import com.mts.common.model.NodeState;
import com.mts.common.status.Result;
import com.mts.common.util.ZookeeperUtil;
import com.mts.master.catalog.CatalogStore;
import com.mts.master.placement.LeastLoadedPlacementPolicy;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.test.TestingServer;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ZkCatalogPersistenceTest {
    private static final String BASE_PATH = "/mts/catalog";

    private TestingServer zkServer;
    private CuratorFramework client;
    private ZkCatalogPersistence persistence;

    @Before
    public void setUp() throws Exception {
        zkServer = new TestingServer(true);
        client = ZookeeperUtil.connect(zkServer.getConnectString(), 10000);
        persistence = new ZkCatalogPersistence(client, BASE_PATH + "/");
    }

    @After
    public void tearDown() throws Exception {
        persistence.close();
        client.close();
        zkServer.close();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static List<String> keys(List<Map.Entry<String, byte[]>> entries) {
        List<String> keys = new ArrayList<>();
        entries.forEach(e -> keys.add(e.getKey()));
        return keys;
    }

    @Test
    public void testCommitAndScanInKeyOrder() throws Exception {
        Map<String, byte[]> writes = new LinkedHashMap<>();
        writes.put("tables/b", bytes("B"));
        writes.put("tables/a", bytes("A"));
        writes.put("tablets/x", bytes("X"));
        persistence.atomicCommit(writes);

        List<Map.Entry<String, byte[]>> tables = persistence.scanPrefix("tables/");
        assertEquals(List.of("tables/a", "tables/b"), keys(tables));
        assertEquals("A", new String(tables.get(0).getValue(), StandardCharsets.UTF_8));

        // tables/ 与 tablets/ 互不干扰
        assertEquals(List.of("tablets/x"), keys(persistence.scanPrefix("tablets/")));
        assertNotNull(client.checkExists().forPath(BASE_PATH + "/tablets/x"));
    }

    @Test
    public void testOverwriteExistingKey() throws Exception {
        persistence.atomicCommit(Map.of("tables/a", bytes("v1")));
        persistence.atomicCommit(Map.of("tables/a", bytes("v2"), "tables/c", bytes("c")));

        List<Map.Entry<String, byte[]>> tables = persistence.scanPrefix("tables/");
        assertEquals(2, tables.size());
        assertEquals("v2", new String(tables.get(0).getValue(), StandardCharsets.UTF_8));
    }

    @Test
    public void testScanMissingDirectoryIsEmpty() throws Exception {
        assertTrue(persistence.scanPrefix("tablets/").isEmpty());
        persistence.atomicCommit(Map.of());
        assertTrue(persistence.scanPrefix("tables/").isEmpty());
    }

    @Test
    public void testInvalidKeyFailsWholeCommit() throws Exception {
        Map<String, byte[]> writes = new LinkedHashMap<>();
        writes.put("tables/ok", bytes("ok"));
        writes.put("tables/", bytes("bad"));
        try {
            persistence.atomicCommit(writes);
            fail("应当抛出 PersistenceException");
        } catch (PersistenceException e) {
            assertTrue(e.getMessage().contains("Invalid catalog key"));
        }
        assertTrue(persistence.scanPrefix("tables/").isEmpty());
    }

    @Test
    public void testCatalogSurvivesReconnect() throws Exception {
        List<NodeInfo> nodes = new ArrayList<>();
        for (int i = 1; i <= 3; i++) {
            NodeInfo node = new NodeInfo("ts-" + i, "127.0.0.1", 7050 + i, 0);
            node.setState(NodeState.LIVE);
            nodes.add(node);
        }
        CatalogStore store = new CatalogStore(persistence, new LeastLoadedPlacementPolicy(), () -> 1L);
        store.recover();
        Result<String> created = store.createTable("events",
                List.of(new ColumnSchema("id", DataType.INT64, false)), List.of("k"), 3, nodes);
        assertTrue(created.isSuccess());
        assertTrue(store.deleteTable("events").isSuccess());
        assertTrue(store.createTable("events",
                List.of(new ColumnSchema("id", DataType.STRING, false)), List.of(), 2, nodes).isSuccess());

        // 新客户端重新加载目录
        try (CuratorFramework other = ZookeeperUtil.connect(zkServer.getConnectString(), 10000)) {
            CatalogStore recovered = new CatalogStore(new ZkCatalogPersistence(other, BASE_PATH),
                    new LeastLoadedPlacementPolicy(), () -> 2L);
            recovered.recover();
            assertEquals(store.snapshot().getAllTables(), recovered.snapshot().getAllTables());
            assertEquals(store.snapshot().getAllTablets(), recovered.snapshot().getAllTablets());
            assertEquals(1, recovered.listTables().size());
            assertEquals(DataType.STRING,
                    recovered.getTableInfo("events").getValue().getTable().getColumns().get(0).getType());
        }
    }
}
