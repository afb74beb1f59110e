package com.mts.client;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class AdminShellTest {

    private MasterClient client;
    private AdminShell shell;

    @BeforeEach
    public void setUp() {
        client = mock(MasterClient.class);
        shell = new AdminShell(client);
    }

    @Test
    public void testBuildCreateRequest() {
        JSONObject request = AdminShell.buildRequest("create orders id:int64,note:string? 3 g,p");
        assertEquals("CREATE_TABLE", request.getString("type"));
        assertEquals("orders", request.getString("tableName"));
        assertEquals(3, request.getInt("replicationFactor"));
        assertEquals(2, request.getJSONArray("splitKeys").length());

        JSONArray columns = request.getJSONArray("columns");
        assertEquals("INT64", columns.getJSONObject(0).getString("type"));
        assertFalse(columns.getJSONObject(0).getBoolean("nullable"));
        assertEquals("STRING", columns.getJSONObject(1).getString("type"));
        assertTrue(columns.getJSONObject(1).getBoolean("nullable"));

        assertTrue(AdminShell.buildRequest("create t id:INT64 1").getJSONArray("splitKeys").isEmpty());
    }

    @Test
    public void testBuildOtherRequests() {
        JSONObject reassign = AdminShell.buildRequest("reassign tab-1 ts-1,ts-2 ts-3,ts-2");
        assertEquals("REASSIGN_REPLICAS", reassign.getString("type"));
        assertEquals("ts-3", reassign.getJSONArray("newReplicas").getString(0));
        assertEquals(2, reassign.getJSONArray("expectedReplicas").length());

        assertEquals("DELETE_TABLE", AdminShell.buildRequest("DROP t").getString("type"));
        assertEquals("ts-9", AdminShell.buildRequest("decommission ts-9").getString("nodeId"));
        assertEquals("MASTER_STATUS", AdminShell.buildRequest("status").getString("type"));
        assertEquals("LIST_NODES", AdminShell.buildRequest("nodes").getString("type"));
    }

    @Test
    public void testMalformedCommands() {
        assertThrows(IllegalArgumentException.class, () -> AdminShell.buildRequest("truncate t"));
        assertThrows(IllegalArgumentException.class, () -> AdminShell.buildRequest("create t id:INT64"));
        assertThrows(IllegalArgumentException.class, () -> AdminShell.buildRequest("create t id:INT64 three"));
        assertThrows(IllegalArgumentException.class, () -> AdminShell.parseColumns("id"));
        assertThrows(IllegalArgumentException.class, () -> AdminShell.buildRequest("drop"));
    }

    @Test
    public void testExecuteFormatsResponses() throws Exception {
        when(client.sendRequest(any())).thenReturn(
                new JSONObject().put("status", "ok"),
                new JSONObject().put("status", "error").put("code", "NOT_FOUND").put("message", "Table not found: t"),
                new JSONObject().put("status", "ok").put("tableId", "abc"));

        assertEquals("OK", shell.execute("drop t"));
        assertEquals("失败 [NOT_FOUND]: Table not found: t", shell.execute("describe t"));
        String created = shell.execute("create t id:INT64 1");
        assertTrue(created.contains("\"tableId\": \"abc\""), created);
        assertFalse(created.contains("status"));

        ArgumentCaptor<JSONObject> captor = ArgumentCaptor.forClass(JSONObject.class);
        verify(client, times(3)).sendRequest(captor.capture());
        assertEquals("GET_TABLE_INFO", captor.getAllValues().get(1).getString("type"));
    }

    @Test
    public void testExecuteWithoutRoundTrip() throws Exception {
        assertEquals("", shell.execute("   "));
        assertEquals(AdminShell.USAGE, shell.execute("help"));
        assertTrue(shell.execute("bogus").startsWith("命令错误: "));
        verify(client, never()).sendRequest(any());
    }
}
