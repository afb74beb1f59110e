package com.mts.common.constant;

/**
 * Master 请求/响应 JSON 报文的字段与取值。
 */
public class MessageFormat {
    // 请求类型
    public static final String TYPE_HEARTBEAT = "HEARTBEAT";
    public static final String TYPE_CREATE_TABLE = "CREATE_TABLE";
    public static final String TYPE_DELETE_TABLE = "DELETE_TABLE";
    public static final String TYPE_LIST_TABLES = "LIST_TABLES";
    public static final String TYPE_GET_TABLE_INFO = "GET_TABLE_INFO";
    public static final String TYPE_REASSIGN_REPLICAS = "REASSIGN_REPLICAS";
    public static final String TYPE_DECOMMISSION_NODE = "DECOMMISSION_NODE";
    public static final String TYPE_LIST_NODES = "LIST_NODES";
    public static final String TYPE_MASTER_STATUS = "MASTER_STATUS";

    // 通用字段
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_STATUS = "status";
    public static final String FIELD_CODE = "code";
    public static final String FIELD_MESSAGE = "message";
    public static final String FIELD_TIMEOUT_MS = "timeoutMs";

    // 心跳字段
    public static final String FIELD_NODE_ID = "nodeId";
    public static final String FIELD_HOST = "host";
    public static final String FIELD_PORT = "port";
    public static final String FIELD_TABLET_COUNT = "tabletCount";
    public static final String FIELD_SEQUENCE = "sequence";
    public static final String FIELD_DELETED_TABLETS = "deletedTablets";
    public static final String FIELD_IS_NEW_NODE = "isNewNode";
    public static final String FIELD_TABLETS_TO_DELETE = "tabletsToDelete";

    // 目录字段
    public static final String FIELD_TABLE_NAME = "tableName";
    public static final String FIELD_TABLE_ID = "tableId";
    public static final String FIELD_COLUMNS = "columns";
    public static final String FIELD_SPLIT_KEYS = "splitKeys";
    public static final String FIELD_REPLICATION_FACTOR = "replicationFactor";
    public static final String FIELD_TABLE = "table";
    public static final String FIELD_TABLES = "tables";
    public static final String FIELD_TABLETS = "tablets";
    public static final String FIELD_TABLET_ID = "tabletId";
    public static final String FIELD_EXPECTED_REPLICAS = "expectedReplicas";
    public static final String FIELD_NEW_REPLICAS = "newReplicas";
    public static final String FIELD_NODES = "nodes";

    // 状态字段
    public static final String FIELD_STATE = "state";
    public static final String FIELD_HEALTHY = "healthy";
    public static final String FIELD_LIVE_NODES = "liveNodes";
    public static final String FIELD_TABLE_COUNT = "tableCount";

    // 响应状态
    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";
}
