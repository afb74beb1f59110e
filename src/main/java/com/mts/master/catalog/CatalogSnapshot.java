package com.mts.master.catalog;

import com.mts.common.model.TableInfo;
import com.mts.common.model.TabletInfo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 目录的不可变快照，每次提交成功后由 CatalogStore 整体替换。访问方法返回记录副本。
 */
public final class CatalogSnapshot {
    private static final CatalogSnapshot EMPTY = new CatalogSnapshot(Collections.emptyMap(), Collections.emptyMap());

    private final Map<String, TableInfo> tablesById;            // 包括已删除的表
    private final Map<String, TabletInfo> tabletsById;
    private final Map<String, String> liveTableIdsByName;       // 只包含未删除的表
    private final Map<String, List<String>> tabletIdsByTable;   // 按起始 key 排序

    private CatalogSnapshot(Map<String, TableInfo> tablesById, Map<String, TabletInfo> tabletsById) {
        this.tablesById = tablesById;
        this.tabletsById = tabletsById;

        Map<String, String> byName = new HashMap<>();
        for (TableInfo table : tablesById.values()) {
            if (!table.isDeleted()) {
                byName.put(table.getTableName(), table.getTableId());
            }
        }
        this.liveTableIdsByName = Collections.unmodifiableMap(byName);

        Map<String, List<String>> byTable = tabletsById.values().stream()
                .sorted(Comparator.comparing(TabletInfo::getStartKey))
                .collect(Collectors.groupingBy(TabletInfo::getTableId, HashMap::new,
                        Collectors.mapping(TabletInfo::getTabletId, Collectors.toList())));
        this.tabletIdsByTable = Collections.unmodifiableMap(byTable);
    }

    public static CatalogSnapshot empty() {
        return EMPTY;
    }

    static CatalogSnapshot of(Collection<TableInfo> tables, Collection<TabletInfo> tablets) {
        Map<String, TableInfo> tableMap = new HashMap<>();
        tables.forEach(table -> tableMap.put(table.getTableId(), table));
        Map<String, TabletInfo> tabletMap = new HashMap<>();
        tablets.forEach(tablet -> tabletMap.put(tablet.getTabletId(), tablet));
        return new CatalogSnapshot(Collections.unmodifiableMap(tableMap), Collections.unmodifiableMap(tabletMap));
    }

    /** 复制当前快照并替换给定记录（写时复制）。 */
    CatalogSnapshot with(Collection<TableInfo> changedTables, Collection<TabletInfo> changedTablets) {
        Map<String, TableInfo> tableMap = new HashMap<>(tablesById);
        changedTables.forEach(table -> tableMap.put(table.getTableId(), table));
        Map<String, TabletInfo> tabletMap = new HashMap<>(tabletsById);
        changedTablets.forEach(tablet -> tabletMap.put(tablet.getTabletId(), tablet));
        return new CatalogSnapshot(Collections.unmodifiableMap(tableMap), Collections.unmodifiableMap(tabletMap));
    }

    public Optional<TableInfo> getTable(String tableId) {
        TableInfo table = tablesById.get(tableId);
        return table == null ? Optional.empty() : Optional.of(new TableInfo(table));
    }

    public Optional<TableInfo> getLiveTableByName(String tableName) {
        String tableId = liveTableIdsByName.get(tableName);
        return tableId == null ? Optional.empty() : getTable(tableId);
    }

    public Optional<TabletInfo> getTablet(String tabletId) {
        TabletInfo tablet = tabletsById.get(tabletId);
        return tablet == null ? Optional.empty() : Optional.of(new TabletInfo(tablet));
    }

    /** 表的所有 tablet，按起始 key 排序。 */
    public List<TabletInfo> getTablets(String tableId) {
        List<TabletInfo> result = new ArrayList<>();
        for (String tabletId : tabletIdsByTable.getOrDefault(tableId, Collections.emptyList())) {
            result.add(new TabletInfo(tabletsById.get(tabletId)));
        }
        return result;
    }

    /** 未删除的表，按表名排序。 */
    public List<TableInfo> getLiveTables() {
        return liveTableIdsByName.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(entry -> new TableInfo(tablesById.get(entry.getValue())))
                .collect(Collectors.toList());
    }

    public List<TableInfo> getAllTables() {
        return tablesById.values().stream()
                .map(TableInfo::new)
                .sorted(Comparator.comparing(TableInfo::getTableId))
                .collect(Collectors.toList());
    }

    public List<TabletInfo> getLiveTablets() {
        return tabletsById.values().stream()
                .filter(tablet -> !tablet.isDeleted())
                .map(TabletInfo::new)
                .sorted(Comparator.comparing(TabletInfo::getTabletId))
                .collect(Collectors.toList());
    }

    public List<TabletInfo> getAllTablets() {
        return tabletsById.values().stream()
                .map(TabletInfo::new)
                .sorted(Comparator.comparing(TabletInfo::getTabletId))
                .collect(Collectors.toList());
    }

    /** 每个节点上未删除 tablet 的副本数。 */
    public Map<String, Integer> getReplicaCountsByNode() {
        Map<String, Integer> counts = new HashMap<>();
        for (TabletInfo tablet : tabletsById.values()) {
            if (tablet.isDeleted()) {
                continue;
            }
            for (String nodeId : tablet.getReplicas()) {
                counts.merge(nodeId, 1, Integer::sum);
            }
        }
        return counts;
    }

    /** 未删除 tablet 的副本集中出现过的节点。 */
    public Set<String> getReferencedNodeIds() {
        Set<String> nodeIds = new HashSet<>();
        for (TabletInfo tablet : tabletsById.values()) {
            if (!tablet.isDeleted()) {
                nodeIds.addAll(tablet.getReplicas());
            }
        }
        return nodeIds;
    }

    /** 已删除但仍由该节点持有副本的 tablet，存储节点据此清理数据。 */
    public List<String> getDeletedTabletIdsHostedOn(String nodeId) {
        return tabletsById.values().stream()
                .filter(tablet -> tablet.isDeleted() && tablet.getReplicas().contains(nodeId))
                .map(TabletInfo::getTabletId)
                .sorted()
                .collect(Collectors.toList());
    }

    public int getLiveTableCount() {
        return liveTableIdsByName.size();
    }
}
