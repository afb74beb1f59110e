package com.mts.master;

import java.util.List;

/**
 * 心跳应答：节点是否刚变为 LIVE，以及该节点上需要清理的已删除 tablet。
 */
public final class HeartbeatResponse {
    private final boolean newNode;
    private final List<String> tabletsToDelete;

    public HeartbeatResponse(boolean newNode, List<String> tabletsToDelete) {
        this.newNode = newNode;
        this.tabletsToDelete = List.copyOf(tabletsToDelete);
    }

    public boolean isNewNode() {
        return newNode;
    }

    public List<String> getTabletsToDelete() {
        return tabletsToDelete;
    }

    @Override
    public String toString() {
        return "HeartbeatResponse{newNode=" + newNode + ", tabletsToDelete=" + tabletsToDelete + '}';
    }
}
