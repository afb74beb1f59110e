package com.mts.master;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mts.common.constant.MessageFormat;
import com.mts.common.model.ColumnSchema;
import com.mts.common.model.NodeInfo;
import com.mts.common.model.TableDetails;
import com.mts.common.model.TableSummary;
import com.mts.common.status.Result;
import com.mts.common.status.StatusCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Master 对外的 RPC 入口。未处于 RUNNING 时除 MASTER_STATUS 外一律返回 UNAVAILABLE。
 */
public class AdminFacade {
    private static final Logger logger = LoggerFactory.getLogger(AdminFacade.class);

    private static final TypeReference<List<ColumnSchema>> COLUMN_LIST = new TypeReference<List<ColumnSchema>>() {
    };
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<List<String>>() {
    };
    private static final TypeReference<Map<String, Object>> JSON_MAP = new TypeReference<Map<String, Object>>() {
    };

    private final Coordinator coordinator;
    private final long defaultTimeoutMs;
    private final ObjectMapper mapper = new ObjectMapper();

    public AdminFacade(Coordinator coordinator) {
        this(coordinator, coordinator.getOptions().getRpcDefaultTimeoutMs());
    }

    public AdminFacade(Coordinator coordinator, long defaultTimeoutMs) {
        this.coordinator = coordinator;
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public Result<HeartbeatResponse> heartbeat(String nodeId, String host, int port, int reportedTabletCount,
            long sequence) {
        return heartbeat(nodeId, host, port, reportedTabletCount, sequence, Collections.emptyList());
    }

    public Result<HeartbeatResponse> heartbeat(String nodeId, String host, int port, int reportedTabletCount,
            long sequence, List<String> deletedTabletIds) {
        if (!coordinator.isRunning()) {
            return rejected();
        }
        return coordinator.heartbeat(nodeId, host, port, reportedTabletCount, sequence, deletedTabletIds);
    }

    public Result<String> createTable(String tableName, List<ColumnSchema> columns, List<String> splitKeys,
            int replicationFactor, long timeoutMs) {
        if (!coordinator.isRunning()) {
            return rejected();
        }
        return coordinator.createTable(tableName, columns, splitKeys, replicationFactor, timeoutMs);
    }

    public Result<Void> deleteTable(String tableName, long timeoutMs) {
        if (!coordinator.isRunning()) {
            return rejected();
        }
        return coordinator.deleteTable(tableName, timeoutMs);
    }

    public Result<List<TableSummary>> listTables() {
        if (!coordinator.isRunning()) {
            return rejected();
        }
        return coordinator.listTables();
    }

    public Result<TableDetails> getTableInfo(String tableName) {
        if (!coordinator.isRunning()) {
            return rejected();
        }
        if (tableName == null || tableName.trim().isEmpty()) {
            return Result.invalidArgument("Table name must not be empty");
        }
        return coordinator.getTableInfo(tableName);
    }

    public Result<Void> reassignReplicas(String tabletId, List<String> expectedReplicas, List<String> newReplicas,
            long timeoutMs) {
        if (!coordinator.isRunning()) {
            return rejected();
        }
        return coordinator.reassignReplicas(tabletId, expectedReplicas, newReplicas, timeoutMs);
    }

    public Result<Void> decommissionNode(String nodeId) {
        if (!coordinator.isRunning()) {
            return rejected();
        }
        return coordinator.decommissionNode(nodeId);
    }

    public Result<List<NodeInfo>> listNodes() {
        if (!coordinator.isRunning()) {
            return rejected();
        }
        return coordinator.listNodes();
    }

    public MasterStatus masterStatus() {
        return coordinator.status();
    }

    // 解析一条请求并返回响应
    public Map<String, Object> handle(Map<String, Object> request) {
        Object type = request.get(MessageFormat.FIELD_TYPE);
        if (!(type instanceof String)) {
            return errorResponse(StatusCode.INVALID_ARGUMENT, "Request has no type");
        }
        try {
            switch (((String) type).toUpperCase()) {
                case MessageFormat.TYPE_HEARTBEAT:
                    return handleHeartbeat(request);
                case MessageFormat.TYPE_CREATE_TABLE:
                    return handleCreateTable(request);
                case MessageFormat.TYPE_DELETE_TABLE:
                    return toResponse(deleteTable(stringField(request, MessageFormat.FIELD_TABLE_NAME),
                            timeoutOf(request)), Collections.emptyMap());
                case MessageFormat.TYPE_LIST_TABLES:
                    return handleListTables();
                case MessageFormat.TYPE_GET_TABLE_INFO:
                    return handleGetTableInfo(request);
                case MessageFormat.TYPE_REASSIGN_REPLICAS:
                    return toResponse(reassignReplicas(stringField(request, MessageFormat.FIELD_TABLET_ID),
                            listField(request, MessageFormat.FIELD_EXPECTED_REPLICAS),
                            listField(request, MessageFormat.FIELD_NEW_REPLICAS),
                            timeoutOf(request)), Collections.emptyMap());
                case MessageFormat.TYPE_DECOMMISSION_NODE:
                    return toResponse(decommissionNode(stringField(request, MessageFormat.FIELD_NODE_ID)),
                            Collections.emptyMap());
                case MessageFormat.TYPE_LIST_NODES:
                    return handleListNodes();
                case MessageFormat.TYPE_MASTER_STATUS:
                    return handleMasterStatus();
                default:
                    return errorResponse(StatusCode.INVALID_ARGUMENT, "Unknown request type: " + type);
            }
        } catch (IllegalArgumentException | ClassCastException e) {
            // 字段缺失或类型不对
            logger.debug("拒绝格式错误的 {} 请求: {}", type, e.getMessage());
            return errorResponse(StatusCode.INVALID_ARGUMENT, "Malformed " + type + " request: " + e.getMessage());
        }
    }

    private Map<String, Object> handleHeartbeat(Map<String, Object> request) {
        Result<HeartbeatResponse> result = heartbeat(
                stringField(request, MessageFormat.FIELD_NODE_ID),
                stringField(request, MessageFormat.FIELD_HOST),
                intField(request, MessageFormat.FIELD_PORT, 0),
                intField(request, MessageFormat.FIELD_TABLET_COUNT, 0),
                longField(request, MessageFormat.FIELD_SEQUENCE, 0L),
                listField(request, MessageFormat.FIELD_DELETED_TABLETS));
        if (result.isFailure()) {
            return errorResponse(result);
        }
        Map<String, Object> body = new HashMap<>();
        body.put(MessageFormat.FIELD_IS_NEW_NODE, result.getValue().isNewNode());
        body.put(MessageFormat.FIELD_TABLETS_TO_DELETE, result.getValue().getTabletsToDelete());
        return okResponse(body);
    }

    private Map<String, Object> handleCreateTable(Map<String, Object> request) {
        Object columns = request.get(MessageFormat.FIELD_COLUMNS);
        Object splitKeys = request.get(MessageFormat.FIELD_SPLIT_KEYS);
        Result<String> result = createTable(
                stringField(request, MessageFormat.FIELD_TABLE_NAME),
                columns == null ? null : mapper.convertValue(columns, COLUMN_LIST),
                splitKeys == null ? Collections.emptyList() : mapper.convertValue(splitKeys, STRING_LIST),
                intField(request, MessageFormat.FIELD_REPLICATION_FACTOR, 0),
                timeoutOf(request));
        if (result.isFailure()) {
            return errorResponse(result);
        }
        return okResponse(Map.of(MessageFormat.FIELD_TABLE_ID, result.getValue()));
    }

    private Map<String, Object> handleListTables() {
        Result<List<TableSummary>> result = listTables();
        if (result.isFailure()) {
            return errorResponse(result);
        }
        return okResponse(Map.of(MessageFormat.FIELD_TABLES, mapper.convertValue(result.getValue(), List.class)));
    }

    private Map<String, Object> handleGetTableInfo(Map<String, Object> request) {
        Result<TableDetails> result = getTableInfo(stringField(request, MessageFormat.FIELD_TABLE_NAME));
        if (result.isFailure()) {
            return errorResponse(result);
        }
        Map<String, Object> body = new HashMap<>();
        body.put(MessageFormat.FIELD_TABLE, mapper.convertValue(result.getValue().getTable(), JSON_MAP));
        body.put(MessageFormat.FIELD_TABLETS, mapper.convertValue(result.getValue().getTablets(), List.class));
        return okResponse(body);
    }

    private Map<String, Object> handleListNodes() {
        Result<List<NodeInfo>> result = listNodes();
        if (result.isFailure()) {
            return errorResponse(result);
        }
        return okResponse(Map.of(MessageFormat.FIELD_NODES, mapper.convertValue(result.getValue(), List.class)));
    }

    private Map<String, Object> handleMasterStatus() {
        MasterStatus status = masterStatus();
        Map<String, Object> body = new HashMap<>();
        body.put(MessageFormat.FIELD_STATE, status.getState().name());
        body.put(MessageFormat.FIELD_HEALTHY, status.isHealthy());
        body.put(MessageFormat.FIELD_LIVE_NODES, status.getLiveNodes());
        body.put(MessageFormat.FIELD_NODES, status.getTotalNodes());
        body.put(MessageFormat.FIELD_TABLE_COUNT, status.getTableCount());
        return okResponse(body);
    }

    private long timeoutOf(Map<String, Object> request) {
        return longField(request, MessageFormat.FIELD_TIMEOUT_MS, defaultTimeoutMs);
    }

    private static Map<String, Object> toResponse(Result<?> result, Map<String, Object> body) {
        return result.isSuccess() ? okResponse(body) : errorResponse(result);
    }

    private static Map<String, Object> okResponse(Map<String, Object> body) {
        Map<String, Object> response = new HashMap<>(body);
        response.put(MessageFormat.FIELD_STATUS, MessageFormat.STATUS_OK);
        return response;
    }

    static Map<String, Object> errorResponse(Result<?> result) {
        return errorResponse(result.getCode(), result.getMessage());
    }

    static Map<String, Object> errorResponse(StatusCode code, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put(MessageFormat.FIELD_STATUS, MessageFormat.STATUS_ERROR);
        response.put(MessageFormat.FIELD_CODE, code.name());
        response.put(MessageFormat.FIELD_MESSAGE, message);
        return response;
    }

    private <T> Result<T> rejected() {
        return Result.unavailable("Master is not running (state " + coordinator.getState() + ")");
    }

    private static String stringField(Map<String, Object> request, String field) {
        Object value = request.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new IllegalArgumentException(field + " must be a string");
        }
        return (String) value;
    }

    private static int intField(Map<String, Object> request, String field, int defaultValue) {
        Object value = request.get(field);
        if (value == null) {
            return defaultValue;
        }
        long number = integralValue(field, value);
        if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(field + " is out of range: " + value);
        }
        return (int) number;
    }

    private static long longField(Map<String, Object> request, String field, long defaultValue) {
        Object value = request.get(field);
        if (value == null) {
            return defaultValue;
        }
        return integralValue(field, value);
    }

    // 拒绝小数和超出 long 范围的数值，不做截断
    private static long integralValue(String field, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger) {
            try {
                return ((BigInteger) value).longValueExact();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException(field + " is out of range: " + value, e);
            }
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (d != Math.rint(d) || Double.isInfinite(d) || d < Long.MIN_VALUE || d >= Long.MAX_VALUE) {
                throw new IllegalArgumentException(field + " must be an integer: " + value);
            }
            return (long) d;
        }
        throw new IllegalArgumentException(field + " must be a number");
    }

    private List<String> listField(Map<String, Object> request, String field) {
        Object value = request.get(field);
        return value == null ? null : mapper.convertValue(value, STRING_LIST);
    }
}
