package com.mts.common.model;

public enum NodeState {
    UNKNOWN,    // 尚未收到心跳（例如 Master 重启后从副本集中恢复的节点）
    LIVE,
    DEAD
}
