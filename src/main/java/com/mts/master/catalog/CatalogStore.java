package com.mts.master.catalog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mts.common.model.CatalogState;
import com.mts.common.model.ColumnSchema;
import com.mts.common.model.NodeInfo;
import com.mts.common.model.TableDetails;
import com.mts.common.model.TableInfo;
import com.mts.common.model.TableSummary;
import com.mts.common.model.TabletInfo;
import com.mts.common.status.Result;
import com.mts.common.status.StatusCode;
import com.mts.master.persist.CatalogPersistence;
import com.mts.master.persist.PersistenceException;
import com.mts.master.placement.PlacementPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

/**
 * 表、tablet 和副本分配的权威目录。
 * 写操作持全局锁，一次原子提交成功后才发布新快照；读操作直接读快照。
 */
public class CatalogStore {
    private static final Logger logger = LoggerFactory.getLogger(CatalogStore.class);

    static final String TABLE_PREFIX = "tables/";
    static final String TABLET_PREFIX = "tablets/";

    private final CatalogPersistence persistence;
    private final PlacementPolicy placementPolicy;
    private final LongSupplier clock;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ReentrantLock mutationLock = new ReentrantLock();  // 所有写操作的串行化点
    private volatile CatalogSnapshot snapshot = CatalogSnapshot.empty();

    public CatalogStore(CatalogPersistence persistence, PlacementPolicy placementPolicy, LongSupplier clock) {
        this.persistence = persistence;
        this.placementPolicy = placementPolicy;
        this.clock = clock;
    }

    // 从持久化存储重建内存目录，记录不可读或结构不一致时抛出 CatalogRecoveryException
    public void recover() {
        mutationLock.lock();
        try {
            List<TableInfo> tables = new ArrayList<>();
            for (Map.Entry<String, byte[]> entry : persistence.scanPrefix(TABLE_PREFIX)) {
                TableInfo table = decode(entry, TableInfo.class);
                checkRecordKey(entry.getKey(), TABLE_PREFIX + table.getTableId());
                tables.add(table);
            }
            List<TabletInfo> tablets = new ArrayList<>();
            for (Map.Entry<String, byte[]> entry : persistence.scanPrefix(TABLET_PREFIX)) {
                TabletInfo tablet = decode(entry, TabletInfo.class);
                checkRecordKey(entry.getKey(), TABLET_PREFIX + tablet.getTabletId());
                tablets.add(tablet);
            }

            verifyStructure(tables, tablets);
            snapshot = CatalogSnapshot.of(tables, tablets);
            logger.info("目录恢复完成: {} 张表（{} 张未删除）, {} 个 tablet",
                    tables.size(), snapshot.getLiveTableCount(), tablets.size());
        } catch (PersistenceException e) {
            throw new CatalogRecoveryException("读取持久化目录失败: " + e.getMessage(), e);
        } finally {
            mutationLock.unlock();
        }
    }

    public Result<String> createTable(String tableName, List<ColumnSchema> columns, List<String> splitKeys,
            int replicationFactor, Collection<NodeInfo> liveNodes) {
        List<String> splits = splitKeys == null ? Collections.emptyList() : splitKeys;
        Result<Void> validation = validateCreateTable(tableName, columns, splits, replicationFactor);
        if (validation.isFailure()) {
            return validation.propagate();
        }

        mutationLock.lock();
        try {
            CatalogSnapshot current = snapshot;
            // 表名检查必须在锁内完成
            if (current.getLiveTableByName(tableName).isPresent()) {
                return Result.failure(StatusCode.ALREADY_EXISTS, "Table already exists: " + tableName);
            }
            if (liveNodes.size() < replicationFactor) {
                return Result.unavailable(String.format(
                        "Not enough live nodes for table %s: need %d, have %d",
                        tableName, replicationFactor, liveNodes.size()));
            }

            String tableId = newId();
            TableInfo table = new TableInfo(tableId, tableName, columns, splits, replicationFactor,
                    clock.getAsLong());

            Map<String, Integer> loads = new HashMap<>(current.getReplicaCountsByNode());
            List<TabletInfo> tablets = new ArrayList<>();
            List<String[]> ranges = keyRanges(splits);
            for (String[] range : ranges) {
                List<String> replicas = placementPolicy.selectReplicas(replicationFactor, liveNodes,
                        Collections.emptySet(), loads);
                if (replicas.size() < replicationFactor) {
                    return Result.unavailable("Placement policy " + placementPolicy.name()
                            + " could not find " + replicationFactor + " nodes for table " + tableName);
                }
                replicas.forEach(nodeId -> loads.merge(nodeId, 1, Integer::sum));
                tablets.add(new TabletInfo(newId(), tableId, range[0], range[1], replicas));
            }

            // 表和全部 tablet 在一次提交中写入，不会出现有表无 tablet 的中间状态
            Map<String, byte[]> writes = new LinkedHashMap<>();
            writes.put(TABLE_PREFIX + tableId, encode(table));
            for (TabletInfo tablet : tablets) {
                writes.put(TABLET_PREFIX + tablet.getTabletId(), encode(tablet));
            }
            persistence.atomicCommit(writes);

            snapshot = current.with(List.of(table), tablets);
            logger.info("创建表成功: {} ({}), {} 个 tablet, 副本数 {}",
                    tableName, tableId, tablets.size(), replicationFactor);
            return Result.success(tableId);
        } catch (PersistenceException e) {
            logger.error("创建表 {} 时持久化失败: {}", tableName, e.getMessage(), e);
            return Result.failure(StatusCode.INTERNAL, "Failed to persist table " + tableName + ": " + e.getMessage());
        } finally {
            mutationLock.unlock();
        }
    }

    public Result<Void> deleteTable(String tableName) {
        if (isBlank(tableName)) {
            return Result.invalidArgument("Table name must not be empty");
        }

        mutationLock.lock();
        try {
            CatalogSnapshot current = snapshot;
            Optional<TableInfo> existing = current.getLiveTableByName(tableName);
            if (existing.isEmpty()) {
                return Result.notFound("Table not found: " + tableName);
            }

            TableInfo table = existing.get();
            table.setState(CatalogState.DELETED);
            table.setDeleteTime(clock.getAsLong());
            List<TabletInfo> tablets = current.getTablets(table.getTableId());
            tablets.forEach(tablet -> tablet.setState(CatalogState.DELETED));

            Map<String, byte[]> writes = new LinkedHashMap<>();
            writes.put(TABLE_PREFIX + table.getTableId(), encode(table));
            for (TabletInfo tablet : tablets) {
                writes.put(TABLET_PREFIX + tablet.getTabletId(), encode(tablet));
            }
            persistence.atomicCommit(writes);

            snapshot = current.with(List.of(table), tablets);
            logger.info("删除表成功: {} ({}), {} 个 tablet 等待存储节点清理",
                    tableName, table.getTableId(), tablets.size());
            return Result.ok();
        } catch (PersistenceException e) {
            logger.error("删除表 {} 时持久化失败: {}", tableName, e.getMessage(), e);
            return Result.failure(StatusCode.INTERNAL, "Failed to persist deletion of " + tableName + ": " + e.getMessage());
        } finally {
            mutationLock.unlock();
        }
    }

    public Result<TableDetails> getTableInfo(String tableName) {
        CatalogSnapshot current = snapshot;
        Optional<TableInfo> table = current.getLiveTableByName(tableName);
        if (table.isEmpty()) {
            return Result.notFound("Table not found: " + tableName);
        }
        return Result.success(new TableDetails(table.get(), current.getTablets(table.get().getTableId())));
    }

    public List<TableSummary> listTables() {
        CatalogSnapshot current = snapshot;
        return current.getLiveTables().stream()
                .map(table -> new TableSummary(table.getTableId(), table.getTableName(),
                        current.getTablets(table.getTableId()).size(), table.getReplicationFactor()))
                .collect(Collectors.toList());
    }

    /** 副本集仍等于 expectedReplicas 时才替换，否则返回 CONFLICT。 */
    public Result<Void> reassignReplicas(String tabletId, List<String> expectedReplicas, List<String> newReplicas) {
        if (isBlank(tabletId)) {
            return Result.invalidArgument("Tablet id must not be empty");
        }
        if (expectedReplicas == null) {
            return Result.invalidArgument("Expected replica set must be supplied");
        }
        if (newReplicas == null || newReplicas.isEmpty()) {
            return Result.invalidArgument("New replica set must not be empty");
        }
        if (newReplicas.stream().anyMatch(CatalogStore::isBlank)
                || new HashSet<>(newReplicas).size() != newReplicas.size()) {
            return Result.invalidArgument("New replica set must contain distinct node ids: " + newReplicas);
        }

        mutationLock.lock();
        try {
            CatalogSnapshot current = snapshot;
            Optional<TabletInfo> existing = current.getTablet(tabletId);
            if (existing.isEmpty() || existing.get().isDeleted()) {
                return Result.notFound("Tablet not found: " + tabletId);
            }

            TabletInfo tablet = existing.get();
            if (!tablet.getReplicas().equals(expectedReplicas)) {
                return Result.failure(StatusCode.CONFLICT, String.format(
                        "Replica set of tablet %s changed: expected %s, found %s",
                        tabletId, expectedReplicas, tablet.getReplicas()));
            }

            List<String> previous = tablet.getReplicas();
            tablet.setReplicas(new ArrayList<>(newReplicas));
            if (tablet.getLeaderHint() == null || !newReplicas.contains(tablet.getLeaderHint())) {
                tablet.setLeaderHint(newReplicas.get(0));
            }
            tablet.setVersion(tablet.getVersion() + 1);

            persistence.atomicCommit(Map.of(TABLET_PREFIX + tabletId, encode(tablet)));

            snapshot = current.with(Collections.emptyList(), List.of(tablet));
            logger.info("tablet {} 副本集变更: {} -> {}", tabletId, previous, newReplicas);
            return Result.ok();
        } catch (PersistenceException e) {
            logger.error("tablet {} 副本集持久化失败: {}", tabletId, e.getMessage(), e);
            return Result.failure(StatusCode.INTERNAL, "Failed to persist replicas of tablet " + tabletId + ": " + e.getMessage());
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * 存储节点确认已清理这些已删除 tablet 的数据，之后不再向它下发删除指令。
     *
     * @return 实际移除的副本数；未删除、不存在或不在该节点上的 tablet 被忽略
     */
    public Result<Integer> acknowledgeTabletDeletion(String nodeId, Collection<String> tabletIds) {
        if (isBlank(nodeId)) {
            return Result.invalidArgument("Node id must not be empty");
        }
        if (tabletIds == null || tabletIds.isEmpty()) {
            return Result.success(0);
        }

        mutationLock.lock();
        try {
            CatalogSnapshot current = snapshot;
            List<TabletInfo> changed = new ArrayList<>();
            for (String tabletId : new HashSet<>(tabletIds)) {
                Optional<TabletInfo> existing = current.getTablet(tabletId);
                if (existing.isEmpty() || !existing.get().isDeleted()
                        || !existing.get().getReplicas().contains(nodeId)) {
                    continue;
                }
                TabletInfo tablet = existing.get();
                List<String> remaining = new ArrayList<>(tablet.getReplicas());
                remaining.remove(nodeId);
                tablet.setReplicas(remaining);
                tablet.setVersion(tablet.getVersion() + 1);
                changed.add(tablet);
            }
            if (changed.isEmpty()) {
                return Result.success(0);
            }

            Map<String, byte[]> writes = new LinkedHashMap<>();
            for (TabletInfo tablet : changed) {
                writes.put(TABLET_PREFIX + tablet.getTabletId(), encode(tablet));
            }
            persistence.atomicCommit(writes);

            snapshot = current.with(Collections.emptyList(), changed);
            logger.info("节点 {} 已清理 {} 个已删除 tablet", nodeId, changed.size());
            return Result.success(changed.size());
        } catch (PersistenceException e) {
            logger.error("记录节点 {} 的 tablet 清理结果失败: {}", nodeId, e.getMessage(), e);
            return Result.failure(StatusCode.INTERNAL, "Failed to persist deletion acks of " + nodeId + ": " + e.getMessage());
        } finally {
            mutationLock.unlock();
        }
    }

    public Optional<TabletInfo> getTablet(String tabletId) {
        return snapshot.getTablet(tabletId);
    }

    public CatalogSnapshot snapshot() {
        return snapshot;
    }

    // 校验建表参数，不修改任何状态
    static Result<Void> validateCreateTable(String tableName, List<ColumnSchema> columns, List<String> splitKeys,
            int replicationFactor) {
        if (isBlank(tableName)) {
            return Result.invalidArgument("Table name must not be empty");
        }
        if (columns == null || columns.isEmpty()) {
            return Result.invalidArgument("Schema of table " + tableName + " must have at least one column");
        }
        Set<String> names = new HashSet<>();
        for (ColumnSchema column : columns) {
            if (column == null || isBlank(column.getName())) {
                return Result.invalidArgument("Column name must not be empty");
            }
            if (column.getType() == null) {
                return Result.invalidArgument("Column " + column.getName() + " has no type");
            }
            if (!names.add(column.getName())) {
                return Result.invalidArgument("Duplicate column name: " + column.getName());
            }
        }
        if (replicationFactor < 1) {
            return Result.invalidArgument("Replication factor must be at least 1, got " + replicationFactor);
        }
        for (int i = 0; i < splitKeys.size(); i++) {
            String split = splitKeys.get(i);
            if (split == null || split.isEmpty()) {
                return Result.invalidArgument("Split keys must not be empty");
            }
            if (i > 0 && split.compareTo(splitKeys.get(i - 1)) <= 0) {
                return Result.invalidArgument("Split keys must be strictly increasing: " + splitKeys);
            }
        }
        return Result.ok();
    }

    /** k 个分区边界切出 k+1 个 [start, end) 区间，空串表示无界。 */
    static List<String[]> keyRanges(List<String> splitKeys) {
        List<String[]> ranges = new ArrayList<>();
        String start = "";
        for (String split : splitKeys) {
            ranges.add(new String[]{start, split});
            start = split;
        }
        ranges.add(new String[]{start, ""});
        return ranges;
    }

    private void verifyStructure(List<TableInfo> tables, List<TabletInfo> tablets) {
        Map<String, TableInfo> tablesById = new HashMap<>();
        Set<String> liveNames = new HashSet<>();
        for (TableInfo table : tables) {
            if (table.getTableId() == null || table.getTableName() == null || table.getState() == null
                    || table.getColumns() == null || table.getSplitKeys() == null) {
                throw new CatalogRecoveryException("Incomplete table record: " + table);
            }
            tablesById.put(table.getTableId(), table);
            if (!table.isDeleted() && !liveNames.add(table.getTableName())) {
                throw new CatalogRecoveryException("Duplicate live table name: " + table.getTableName());
            }
        }

        Map<String, List<TabletInfo>> tabletsByTable = new HashMap<>();
        for (TabletInfo tablet : tablets) {
            if (tablet.getTabletId() == null || tablet.getStartKey() == null || tablet.getEndKey() == null
                    || tablet.getReplicas() == null || tablet.getState() == null) {
                throw new CatalogRecoveryException("Incomplete tablet record: " + tablet);
            }
            TableInfo owner = tablesById.get(tablet.getTableId());
            if (owner == null) {
                throw new CatalogRecoveryException(String.format(
                        "Tablet %s references nonexistent table %s", tablet.getTabletId(), tablet.getTableId()));
            }
            if (owner.getState() != tablet.getState()) {
                throw new CatalogRecoveryException(String.format(
                        "Tablet %s is %s but its table %s is %s",
                        tablet.getTabletId(), tablet.getState(), owner.getTableId(), owner.getState()));
            }
            tabletsByTable.computeIfAbsent(tablet.getTableId(), id -> new ArrayList<>()).add(tablet);
        }

        for (TableInfo table : tables) {
            if (table.isDeleted()) {
                continue;
            }
            List<TabletInfo> owned = new ArrayList<>(tabletsByTable.getOrDefault(table.getTableId(), List.of()));
            owned.sort((a, b) -> a.getStartKey().compareTo(b.getStartKey()));
            List<String[]> expected = keyRanges(table.getSplitKeys());
            if (owned.size() != expected.size()) {
                throw new CatalogRecoveryException(String.format("Table %s has %d tablets, expected %d",
                        table.getTableName(), owned.size(), expected.size()));
            }
            for (int i = 0; i < expected.size(); i++) {
                TabletInfo tablet = owned.get(i);
                if (!tablet.getStartKey().equals(expected.get(i)[0]) || !tablet.getEndKey().equals(expected.get(i)[1])) {
                    throw new CatalogRecoveryException(String.format(
                            "Key ranges of table %s do not cover the key space: tablet %s has [%s, %s)",
                            table.getTableName(), tablet.getTabletId(), tablet.getStartKey(), tablet.getEndKey()));
                }
            }
        }
    }

    private static void checkRecordKey(String actual, String expected) {
        if (!actual.equals(expected)) {
            throw new CatalogRecoveryException("Record stored under " + actual + " belongs to " + expected);
        }
    }

    private byte[] encode(Object record) throws PersistenceException {
        try {
            return objectMapper.writeValueAsBytes(record);
        } catch (IOException e) {
            throw new PersistenceException("序列化目录记录失败: " + record, e);
        }
    }

    private <T> T decode(Map.Entry<String, byte[]> entry, Class<T> type) {
        try {
            return objectMapper.readValue(entry.getValue(), type);
        } catch (IOException e) {
            throw new CatalogRecoveryException("Unreadable catalog record " + entry.getKey(), e);
        }
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
