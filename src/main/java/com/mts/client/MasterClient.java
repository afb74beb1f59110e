package com.mts.client;

import com.mts.common.constant.MessageFormat;
import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 与 Master 的长连接，每个请求一行 JSON，同步等待一行响应。非线程安全。
 */
public class MasterClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MasterClient.class);

    private Socket masterSocket;
    private PrintWriter out;
    private BufferedReader in;

    public void connect(String host, int port) throws IOException {
        masterSocket = new Socket(host, port);
        out = new PrintWriter(masterSocket.getOutputStream(), true, StandardCharsets.UTF_8);
        in = new BufferedReader(new InputStreamReader(masterSocket.getInputStream(), StandardCharsets.UTF_8));
        logger.info("已连接到Master: {}:{}", host, port);
    }

    public JSONObject sendRequest(JSONObject request) throws IOException {
        // 连接检查
        if (out == null || masterSocket == null || masterSocket.isClosed()) {
            throw new IOException("Master连接未初始化或已断开");
        }
        out.println(request.toString());
        String response = in.readLine();
        if (response == null) {
            throw new IOException("Master未返回响应");
        }
        return new JSONObject(response);
    }

    public JSONObject heartbeat(String nodeId, String host, int port, int tabletCount, long sequence)
            throws IOException {
        return heartbeat(nodeId, host, port, tabletCount, sequence, List.of());
    }

    /**
     * @param deletedTablets 已按上次响应的 tabletsToDelete 清理完的 tablet
     */
    public JSONObject heartbeat(String nodeId, String host, int port, int tabletCount, long sequence,
            List<String> deletedTablets) throws IOException {
        JSONObject request = request(MessageFormat.TYPE_HEARTBEAT);
        if (!deletedTablets.isEmpty()) {
            request.put(MessageFormat.FIELD_DELETED_TABLETS, new JSONArray(deletedTablets));
        }
        request.put(MessageFormat.FIELD_NODE_ID, nodeId);
        request.put(MessageFormat.FIELD_HOST, host);
        request.put(MessageFormat.FIELD_PORT, port);
        request.put(MessageFormat.FIELD_TABLET_COUNT, tabletCount);
        request.put(MessageFormat.FIELD_SEQUENCE, sequence);
        return sendRequest(request);
    }

    /**
     * @param columns 每个元素形如 {@code {"name":..,"type":..,"nullable":..}}
     */
    public JSONObject createTable(String tableName, JSONArray columns, List<String> splitKeys,
            int replicationFactor) throws IOException {
        JSONObject request = request(MessageFormat.TYPE_CREATE_TABLE);
        request.put(MessageFormat.FIELD_TABLE_NAME, tableName);
        request.put(MessageFormat.FIELD_COLUMNS, columns);
        request.put(MessageFormat.FIELD_SPLIT_KEYS, new JSONArray(splitKeys));
        request.put(MessageFormat.FIELD_REPLICATION_FACTOR, replicationFactor);
        return sendRequest(request);
    }

    public JSONObject deleteTable(String tableName) throws IOException {
        JSONObject request = request(MessageFormat.TYPE_DELETE_TABLE);
        request.put(MessageFormat.FIELD_TABLE_NAME, tableName);
        return sendRequest(request);
    }

    public JSONObject listTables() throws IOException {
        return sendRequest(request(MessageFormat.TYPE_LIST_TABLES));
    }

    public JSONObject getTableInfo(String tableName) throws IOException {
        JSONObject request = request(MessageFormat.TYPE_GET_TABLE_INFO);
        request.put(MessageFormat.FIELD_TABLE_NAME, tableName);
        return sendRequest(request);
    }

    public JSONObject reassignReplicas(String tabletId, List<String> expectedReplicas, List<String> newReplicas)
            throws IOException {
        JSONObject request = request(MessageFormat.TYPE_REASSIGN_REPLICAS);
        request.put(MessageFormat.FIELD_TABLET_ID, tabletId);
        request.put(MessageFormat.FIELD_EXPECTED_REPLICAS, new JSONArray(expectedReplicas));
        request.put(MessageFormat.FIELD_NEW_REPLICAS, new JSONArray(newReplicas));
        return sendRequest(request);
    }

    public JSONObject decommissionNode(String nodeId) throws IOException {
        JSONObject request = request(MessageFormat.TYPE_DECOMMISSION_NODE);
        request.put(MessageFormat.FIELD_NODE_ID, nodeId);
        return sendRequest(request);
    }

    public JSONObject listNodes() throws IOException {
        return sendRequest(request(MessageFormat.TYPE_LIST_NODES));
    }

    public JSONObject masterStatus() throws IOException {
        return sendRequest(request(MessageFormat.TYPE_MASTER_STATUS));
    }

    public static boolean isOk(JSONObject response) {
        return MessageFormat.STATUS_OK.equals(response.optString(MessageFormat.FIELD_STATUS));
    }

    private static JSONObject request(String type) {
        JSONObject request = new JSONObject();
        request.put(MessageFormat.FIELD_TYPE, type);
        return request;
    }

    @Override
    public void close() {
        try {
            if (out != null)
                out.close();
            if (in != null)
                in.close();
            if (masterSocket != null)
                masterSocket.close();
            logger.info("Master连接已关闭");
        } catch (IOException e) {
            logger.error("关闭Master连接失败: {}", e.getMessage());
        }
    }
}
