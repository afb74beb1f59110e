package com.mts.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public class NodeInfo {
    private String nodeId;              // 存储节点唯一标识
    private String host;
    private int port;
    private long lastHeartbeat;         // 最近一次心跳时间（毫秒）
    private int reportedTabletCount;    // 节点上报的 tablet 数量
    private NodeState state;
    private long lastSequence;          // 最近一次生效心跳的逻辑时间戳
    private long registeredTime;

    // 无参构造函数 for Jackson
    public NodeInfo() {
    }

    public NodeInfo(String nodeId, String host, int port, long registeredTime) {
        this.nodeId = nodeId;
        this.host = host;
        this.port = port;
        this.registeredTime = registeredTime;
        this.state = NodeState.UNKNOWN;
    }

    public NodeInfo(NodeInfo other) {
        this.nodeId = other.nodeId;
        this.host = other.host;
        this.port = other.port;
        this.lastHeartbeat = other.lastHeartbeat;
        this.reportedTabletCount = other.reportedTabletCount;
        this.state = other.state;
        this.lastSequence = other.lastSequence;
        this.registeredTime = other.registeredTime;
    }

    public String getNodeId() {
        return nodeId;
    }

    public void setNodeId(String nodeId) {
        this.nodeId = nodeId;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    @JsonIgnore
    public String getAddress() {
        return host + ":" + port;
    }

    public long getLastHeartbeat() {
        return lastHeartbeat;
    }

    public void setLastHeartbeat(long lastHeartbeat) {
        this.lastHeartbeat = lastHeartbeat;
    }

    public int getReportedTabletCount() {
        return reportedTabletCount;
    }

    public void setReportedTabletCount(int reportedTabletCount) {
        this.reportedTabletCount = reportedTabletCount;
    }

    public NodeState getState() {
        return state;
    }

    public void setState(NodeState state) {
        this.state = state;
    }

    @JsonIgnore
    public boolean isLive() {
        return state == NodeState.LIVE;
    }

    public long getLastSequence() {
        return lastSequence;
    }

    public void setLastSequence(long lastSequence) {
        this.lastSequence = lastSequence;
    }

    public long getRegisteredTime() {
        return registeredTime;
    }

    public void setRegisteredTime(long registeredTime) {
        this.registeredTime = registeredTime;
    }

    @Override
    public String toString() {
        return String.format("NodeInfo{id=%s, address=%s:%d, state=%s, lastHeartbeat=%d, tablets=%d}",
                nodeId, host, port, state, lastHeartbeat, reportedTabletCount);
    }
}
