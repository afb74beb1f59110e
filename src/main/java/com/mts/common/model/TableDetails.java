package com.mts.common.model;

import java.util.List;

/**
 * 一张表及其按起始 key 排序的 tablet 列表。
 */
public class TableDetails {
    private TableInfo table;
    private List<TabletInfo> tablets;

    public TableDetails() {
    }

    public TableDetails(TableInfo table, List<TabletInfo> tablets) {
        this.table = table;
        this.tablets = tablets;
    }

    public TableInfo getTable() {
        return table;
    }

    public void setTable(TableInfo table) {
        this.table = table;
    }

    public List<TabletInfo> getTablets() {
        return tablets;
    }

    public void setTablets(List<TabletInfo> tablets) {
        this.tablets = tablets;
    }

    @Override
    public String toString() {
        return "TableDetails{table=" + table + ", tablets=" + tablets + '}';
    }
}
