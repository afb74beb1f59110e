package com.mts.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class TabletInfo {
    private String tabletId;
    private String tableId;
    private String startKey;            // 包含；空串表示无下界
    private String endKey;              // 不包含；空串表示无上界
    private List<String> replicas;      // 有序副本集（节点 ID）
    private String leaderHint;
    private CatalogState state;
    private long version;               // 每次副本集变更加一

    public TabletInfo() {
    }

    public TabletInfo(String tabletId, String tableId, String startKey, String endKey, List<String> replicas) {
        this.tabletId = tabletId;
        this.tableId = tableId;
        this.startKey = startKey;
        this.endKey = endKey;
        this.replicas = new ArrayList<>(replicas);
        this.leaderHint = replicas.isEmpty() ? null : replicas.get(0);
        this.state = CatalogState.RUNNING;
        this.version = 1;
    }

    public TabletInfo(TabletInfo other) {
        this.tabletId = other.tabletId;
        this.tableId = other.tableId;
        this.startKey = other.startKey;
        this.endKey = other.endKey;
        this.replicas = other.replicas == null ? new ArrayList<>() : new ArrayList<>(other.replicas);
        this.leaderHint = other.leaderHint;
        this.state = other.state;
        this.version = other.version;
    }

    public String getTabletId() {
        return tabletId;
    }

    public void setTabletId(String tabletId) {
        this.tabletId = tabletId;
    }

    public String getTableId() {
        return tableId;
    }

    public void setTableId(String tableId) {
        this.tableId = tableId;
    }

    public String getStartKey() {
        return startKey;
    }

    public void setStartKey(String startKey) {
        this.startKey = startKey;
    }

    public String getEndKey() {
        return endKey;
    }

    public void setEndKey(String endKey) {
        this.endKey = endKey;
    }

    public List<String> getReplicas() {
        return replicas;
    }

    public void setReplicas(List<String> replicas) {
        this.replicas = replicas;
    }

    public String getLeaderHint() {
        return leaderHint;
    }

    public void setLeaderHint(String leaderHint) {
        this.leaderHint = leaderHint;
    }

    public CatalogState getState() {
        return state;
    }

    public void setState(CatalogState state) {
        this.state = state;
    }

    @JsonIgnore
    public boolean isDeleted() {
        return state == CatalogState.DELETED;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    /** key 是否落在 [startKey, endKey) 内。 */
    public boolean containsKey(String key) {
        boolean aboveStart = startKey.isEmpty() || key.compareTo(startKey) >= 0;
        boolean belowEnd = endKey.isEmpty() || key.compareTo(endKey) < 0;
        return aboveStart && belowEnd;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TabletInfo)) return false;
        TabletInfo that = (TabletInfo) o;
        return version == that.version
                && Objects.equals(tabletId, that.tabletId)
                && Objects.equals(tableId, that.tableId)
                && Objects.equals(startKey, that.startKey)
                && Objects.equals(endKey, that.endKey)
                && Objects.equals(replicas, that.replicas)
                && Objects.equals(leaderHint, that.leaderHint)
                && state == that.state;
    }

    @Override
    public int hashCode() {
        return Objects.hash(tabletId, tableId, startKey, endKey, replicas, leaderHint, state, version);
    }

    @Override
    public String toString() {
        return String.format("TabletInfo{id=%s, table=%s, range=[%s, %s), replicas=%s, leader=%s, state=%s, v%d}",
                tabletId, tableId, startKey, endKey, replicas, leaderHint, state, version);
    }
}
