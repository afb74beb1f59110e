package com.mts.common.model;

public class TableSummary {
    private String tableId;
    private String tableName;
    private int tabletCount;
    private int replicationFactor;

    public TableSummary() {
    }

    public TableSummary(String tableId, String tableName, int tabletCount, int replicationFactor) {
        this.tableId = tableId;
        this.tableName = tableName;
        this.tabletCount = tabletCount;
        this.replicationFactor = replicationFactor;
    }

    public String getTableId() {
        return tableId;
    }

    public void setTableId(String tableId) {
        this.tableId = tableId;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public int getTabletCount() {
        return tabletCount;
    }

    public void setTabletCount(int tabletCount) {
        this.tabletCount = tabletCount;
    }

    public int getReplicationFactor() {
        return replicationFactor;
    }

    public void setReplicationFactor(int replicationFactor) {
        this.replicationFactor = replicationFactor;
    }

    @Override
    public String toString() {
        return "TableSummary{" + tableName + " (" + tableId + "), tablets=" + tabletCount
                + ", rf=" + replicationFactor + '}';
    }
}
