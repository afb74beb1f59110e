package com.mts.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class TableInfo {
    private String tableId;                 // 创建时分配，不可变
    private String tableName;
    private List<ColumnSchema> columns;
    private List<String> splitKeys;         // 有序的分区边界
    private int replicationFactor;
    private long createTime;
    private long deleteTime;
    private CatalogState state;

    public TableInfo() {
    }

    public TableInfo(String tableId, String tableName, List<ColumnSchema> columns, List<String> splitKeys,
            int replicationFactor, long createTime) {
        this.tableId = tableId;
        this.tableName = tableName;
        this.columns = copyColumns(columns);
        this.splitKeys = new ArrayList<>(splitKeys);
        this.replicationFactor = replicationFactor;
        this.createTime = createTime;
        this.state = CatalogState.RUNNING;
    }

    public TableInfo(TableInfo other) {
        this.tableId = other.tableId;
        this.tableName = other.tableName;
        this.columns = other.columns == null ? new ArrayList<>() : copyColumns(other.columns);
        this.splitKeys = other.splitKeys == null ? new ArrayList<>() : new ArrayList<>(other.splitKeys);
        this.replicationFactor = other.replicationFactor;
        this.createTime = other.createTime;
        this.deleteTime = other.deleteTime;
        this.state = other.state;
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

    public List<ColumnSchema> getColumns() {
        return columns;
    }

    public void setColumns(List<ColumnSchema> columns) {
        this.columns = columns;
    }

    public List<String> getSplitKeys() {
        return splitKeys;
    }

    public void setSplitKeys(List<String> splitKeys) {
        this.splitKeys = splitKeys;
    }

    public int getReplicationFactor() {
        return replicationFactor;
    }

    public void setReplicationFactor(int replicationFactor) {
        this.replicationFactor = replicationFactor;
    }

    public long getCreateTime() {
        return createTime;
    }

    public void setCreateTime(long createTime) {
        this.createTime = createTime;
    }

    public long getDeleteTime() {
        return deleteTime;
    }

    public void setDeleteTime(long deleteTime) {
        this.deleteTime = deleteTime;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableInfo)) return false;
        TableInfo that = (TableInfo) o;
        return replicationFactor == that.replicationFactor
                && createTime == that.createTime
                && deleteTime == that.deleteTime
                && Objects.equals(tableId, that.tableId)
                && Objects.equals(tableName, that.tableName)
                && Objects.equals(columns, that.columns)
                && Objects.equals(splitKeys, that.splitKeys)
                && state == that.state;
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableId, tableName, columns, splitKeys, replicationFactor, createTime, deleteTime, state);
    }

    @Override
    public String toString() {
        return "TableInfo{" +
                "tableId='" + tableId + '\'' +
                ", tableName='" + tableName + '\'' +
                ", columns=" + columns +
                ", splitKeys=" + splitKeys +
                ", replicationFactor=" + replicationFactor +
                ", createTime=" + createTime +
                ", state=" + state +
                '}';
    }

    // 列定义可变，逐个复制，避免外部修改已发布的表结构
    private static List<ColumnSchema> copyColumns(List<ColumnSchema> columns) {
        List<ColumnSchema> copy = new ArrayList<>(columns.size());
        for (ColumnSchema column : columns) {
            copy.add(column == null ? null : new ColumnSchema(column));
        }
        return copy;
    }
}
