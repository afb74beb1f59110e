package com.mts.common.model;

public enum CatalogState {
    RUNNING,
    DELETED     // 墓碑，等待存储节点清理副本
}
