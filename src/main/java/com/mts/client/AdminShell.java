package com.mts.client;

import com.mts.common.config.SystemConfig;
import com.mts.common.constant.MessageFormat;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Scanner;

/**
 * 运维命令行：把命令翻译成 Master 请求并打印响应。
 * <pre>
 * create &lt;table&gt; &lt;col:TYPE[?],...&gt; &lt;replicas&gt; [split1,split2,...]
 * drop &lt;table&gt;
 * tables
 * describe &lt;table&gt;
 * reassign &lt;tabletId&gt; &lt;expected1,...&gt; &lt;new1,...&gt;
 * nodes
 * decommission &lt;nodeId&gt;
 * status
 * </pre>
 * 列类型后加 {@code ?} 表示可为空。
 */
public class AdminShell {
    static final String USAGE = String.join(System.lineSeparator(),
            "可用命令:",
            "  create <table> <col:TYPE[?],...> <replicas> [split1,split2,...]",
            "  drop <table>",
            "  tables",
            "  describe <table>",
            "  reassign <tabletId> <expected1,...> <new1,...>",
            "  nodes",
            "  decommission <nodeId>",
            "  status",
            "  help | quit");

    private final MasterClient masterClient;

    public AdminShell(MasterClient masterClient) {
        this.masterClient = masterClient;
    }

    /**
     * 执行一条命令，返回要打印的文本。
     */
    public String execute(String line) throws IOException {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        if ("help".equalsIgnoreCase(trimmed)) {
            return USAGE;
        }
        JSONObject request;
        try {
            request = buildRequest(trimmed);
        } catch (IllegalArgumentException e) {
            return "命令错误: " + e.getMessage() + System.lineSeparator() + USAGE;
        }
        JSONObject response = masterClient.sendRequest(request);
        if (!MasterClient.isOk(response)) {
            return String.format("失败 [%s]: %s", response.optString(MessageFormat.FIELD_CODE),
                    response.optString(MessageFormat.FIELD_MESSAGE));
        }
        response.remove(MessageFormat.FIELD_STATUS);
        return response.isEmpty() ? "OK" : response.toString(2);
    }

    // 解析命令行为请求报文
    static JSONObject buildRequest(String line) {
        String[] parts = line.trim().split("\\s+");
        String command = parts[0].toLowerCase(Locale.ROOT);
        JSONObject request = new JSONObject();
        switch (command) {
            case "create":
                requireArgs(parts, 4, 5);
                request.put(MessageFormat.FIELD_TYPE, MessageFormat.TYPE_CREATE_TABLE);
                request.put(MessageFormat.FIELD_TABLE_NAME, parts[1]);
                request.put(MessageFormat.FIELD_COLUMNS, parseColumns(parts[2]));
                request.put(MessageFormat.FIELD_REPLICATION_FACTOR, parseInt(parts[3], "replicas"));
                request.put(MessageFormat.FIELD_SPLIT_KEYS,
                        new JSONArray(parts.length == 5 ? splitList(parts[4]) : Collections.emptyList()));
                return request;
            case "drop":
                requireArgs(parts, 2, 2);
                request.put(MessageFormat.FIELD_TYPE, MessageFormat.TYPE_DELETE_TABLE);
                request.put(MessageFormat.FIELD_TABLE_NAME, parts[1]);
                return request;
            case "tables":
                request.put(MessageFormat.FIELD_TYPE, MessageFormat.TYPE_LIST_TABLES);
                return request;
            case "describe":
                requireArgs(parts, 2, 2);
                request.put(MessageFormat.FIELD_TYPE, MessageFormat.TYPE_GET_TABLE_INFO);
                request.put(MessageFormat.FIELD_TABLE_NAME, parts[1]);
                return request;
            case "reassign":
                requireArgs(parts, 4, 4);
                request.put(MessageFormat.FIELD_TYPE, MessageFormat.TYPE_REASSIGN_REPLICAS);
                request.put(MessageFormat.FIELD_TABLET_ID, parts[1]);
                request.put(MessageFormat.FIELD_EXPECTED_REPLICAS, new JSONArray(splitList(parts[2])));
                request.put(MessageFormat.FIELD_NEW_REPLICAS, new JSONArray(splitList(parts[3])));
                return request;
            case "nodes":
                request.put(MessageFormat.FIELD_TYPE, MessageFormat.TYPE_LIST_NODES);
                return request;
            case "decommission":
                requireArgs(parts, 2, 2);
                request.put(MessageFormat.FIELD_TYPE, MessageFormat.TYPE_DECOMMISSION_NODE);
                request.put(MessageFormat.FIELD_NODE_ID, parts[1]);
                return request;
            case "status":
                request.put(MessageFormat.FIELD_TYPE, MessageFormat.TYPE_MASTER_STATUS);
                return request;
            default:
                throw new IllegalArgumentException("未知命令 " + parts[0]);
        }
    }

    static JSONArray parseColumns(String spec) {
        JSONArray columns = new JSONArray();
        for (String column : splitList(spec)) {
            String[] nameAndType = column.split(":");
            if (nameAndType.length != 2 || nameAndType[0].isEmpty() || nameAndType[1].isEmpty()) {
                throw new IllegalArgumentException("列定义应为 name:TYPE, 实际为 " + column);
            }
            String type = nameAndType[1];
            boolean nullable = type.endsWith("?");
            if (nullable) {
                type = type.substring(0, type.length() - 1);
            }
            JSONObject json = new JSONObject();
            json.put("name", nameAndType[0]);
            json.put("type", type.toUpperCase(Locale.ROOT));
            json.put("nullable", nullable);
            columns.put(json);
        }
        return columns;
    }

    private static List<String> splitList(String csv) {
        List<String> values = new ArrayList<>();
        Arrays.stream(csv.split(",")).map(String::trim).filter(s -> !s.isEmpty()).forEach(values::add);
        return values;
    }

    private static int parseInt(String value, String name) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " 必须是整数: " + value);
        }
    }

    private static void requireArgs(String[] parts, int min, int max) {
        if (parts.length < min || parts.length > max) {
            throw new IllegalArgumentException(parts[0] + " 参数个数不正确");
        }
    }

    public static void main(String[] args) {
        String host = args.length > 0 ? args[0] : "localhost";
        int port = args.length > 1 ? Integer.parseInt(args[1]) : SystemConfig.MASTER_PORT;

        try (MasterClient client = new MasterClient(); Scanner scanner = new Scanner(System.in)) {
            client.connect(host, port);
            AdminShell shell = new AdminShell(client);
            System.out.println("=== Master 管理命令行 (" + host + ":" + port + ") ===");
            System.out.println(USAGE);
            while (true) {
                System.out.print("\nmaster> ");
                if (!scanner.hasNextLine()) {
                    break;
                }
                String input = scanner.nextLine().trim();
                if ("quit".equalsIgnoreCase(input)) {
                    break;
                }
                System.out.println(shell.execute(input));
            }
        } catch (IOException e) {
            System.err.println("与 Master 通信失败: " + e.getMessage());
            System.exit(1);
        }
    }
}
