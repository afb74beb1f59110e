package com.mts.master;

public final class MasterStatus {
    private final MasterState state;
    private final boolean healthy;
    private final int liveNodes;
    private final int totalNodes;
    private final int tableCount;

    public MasterStatus(MasterState state, boolean healthy, int liveNodes, int totalNodes, int tableCount) {
        this.state = state;
        this.healthy = healthy;
        this.liveNodes = liveNodes;
        this.totalNodes = totalNodes;
        this.tableCount = tableCount;
    }

    public MasterState getState() {
        return state;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public int getLiveNodes() {
        return liveNodes;
    }

    public int getTotalNodes() {
        return totalNodes;
    }

    public int getTableCount() {
        return tableCount;
    }

    @Override
    public String toString() {
        return String.format("Master[%s, %s, nodes=%d/%d live, tables=%d]",
                state, healthy ? "healthy" : "UNHEALTHY", liveNodes, totalNodes, tableCount);
    }
}
