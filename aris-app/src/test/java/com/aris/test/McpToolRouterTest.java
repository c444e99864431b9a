package com.aris.test;

import com.aris.infrastructure.mcp.McpSyncClientFactory;
import com.aris.infrastructure.mcp.McpToolRouter;
import com.aris.infrastructure.mcp.ToolCredentialProvider;
import com.aris.infrastructure.mcp.ToolErrorClassifier;
import com.aris.infrastructure.mcp.config.ToolServerProperties;
import com.aris.infrastructure.util.JsonCodec;
import com.aris.types.enums.ToolErrorKindEnum;
import com.aris.types.exception.ToolInvocationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class McpToolRouterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private ToolServerProperties properties;
    private McpSyncClientFactory clientFactory;
    private ExecutorService toolCallWorker;

    @BeforeEach
    public void setUp() {
        properties = new ToolServerProperties();
        properties.setChatScopedTools(new ArrayList<>(List.of("create_pdf")));
        clientFactory = mock(McpSyncClientFactory.class);
        toolCallWorker = Executors.newCachedThreadPool();
    }

    @AfterEach
    public void tearDown() {
        toolCallWorker.shutdownNow();
    }

    @Test
    public void shouldConnectLazilyOncePerServerPerSession() {
        ToolServerProperties.Server workspace = server("workspace", "search_docs", "create_pdf");
        properties.getServers().add(workspace);
        McpSyncClient first = connectedClient();
        McpSyncClient second = connectedClient();
        when(first.callTool(any())).thenReturn(text("{\"hits\":3}"));
        when(second.callTool(any())).thenReturn(text("{\"hits\":1}"));
        when(clientFactory.create(same(workspace), isNull())).thenReturn(first, second);

        McpToolRouter sessionA = router("s-a", "chat-a");
        McpToolRouter sessionB = router("s-b", "chat-b");
        verify(clientFactory, never()).create(any(), any());
        Assertions.assertFalse(sessionA.isConnected());

        sessionA.invoke("search_docs", Map.of("q", "x"), TIMEOUT);
        sessionA.invoke("create_pdf", Map.of("title", "r"), TIMEOUT);
        Map<String, Object> fromB = sessionB.invoke("search_docs", Map.of("q", "y"), TIMEOUT);

        verify(clientFactory, times(2)).create(same(workspace), isNull());
        verify(first, times(2)).callTool(any());
        Assertions.assertEquals(1, fromB.get("hits"));
        Assertions.assertTrue(sessionA.isConnected());

        sessionA.close();
        verify(first).closeGracefully();
        verify(second, never()).closeGracefully();
        ToolInvocationException ex = Assertions.assertThrows(ToolInvocationException.class,
                () -> sessionA.invoke("search_docs", Map.of(), TIMEOUT));
        Assertions.assertEquals(ToolErrorKindEnum.UNREACHABLE, ex.getKind());
    }

    @Test
    public void shouldReplaceChatIdPlaceholders() {
        properties.getServers().add(server("workspace", "search_docs", "create_pdf"));
        McpSyncClient client = connectedClient();
        when(client.callTool(any())).thenReturn(text("{\"ok\":true}"));
        when(clientFactory.create(any(), any())).thenReturn(client);
        McpToolRouter router = router("s-1", "chat-42");

        router.invoke("search_docs", mapOf("chat_id", "current_chat"), TIMEOUT);
        router.invoke("search_docs", mapOf("chat_id", "Current_Session"), TIMEOUT);
        router.invoke("create_pdf", mapOf("title", "q3"), TIMEOUT);
        router.invoke("search_docs", mapOf("q", "x"), TIMEOUT);
        router.invoke("create_pdf", mapOf("chat_id", "chat-7"), TIMEOUT);

        List<McpSchema.CallToolRequest> requests = sentRequests(client, 5);
        Assertions.assertEquals("chat-42", requests.get(0).arguments().get("chat_id"));
        Assertions.assertEquals("chat-42", requests.get(1).arguments().get("chat_id"));
        Assertions.assertEquals("chat-42", requests.get(2).arguments().get("chat_id"));
        Assertions.assertFalse(requests.get(3).arguments().containsKey("chat_id"));
        Assertions.assertEquals("chat-7", requests.get(4).arguments().get("chat_id"));
    }

    @Test
    public void shouldRouteByStaticMappingBeforeDefaultServer() {
        ToolServerProperties.Server mail = server("mail", "send_email");
        ToolServerProperties.Server workspace = server("workspace");
        properties.getServers().addAll(Arrays.asList(mail, workspace));
        properties.setDefaultServer("workspace");
        McpSyncClient mailClient = connectedClient();
        McpSyncClient workspaceClient = connectedClient();
        when(mailClient.callTool(any())).thenReturn(text("{\"message_id\":\"m-1\"}"));
        when(workspaceClient.callTool(any())).thenReturn(text("{\"rows\":2}"));
        when(clientFactory.create(same(mail), any())).thenReturn(mailClient);
        when(clientFactory.create(same(workspace), any())).thenReturn(workspaceClient);
        McpToolRouter router = router("s-1", "chat-1");

        Assertions.assertEquals("m-1", router.invoke("send_email", Map.of(), TIMEOUT).get("message_id"));
        Assertions.assertEquals(2, router.invoke("query_sales", Map.of(), TIMEOUT).get("rows"));

        verify(mailClient).callTool(any());
        verify(workspaceClient).callTool(any());
        verify(workspaceClient, never()).listTools();
        verify(mailClient, never()).listTools();
    }

    @Test
    public void shouldDiscoverRouteWhenNoDefaultServer() {
        ToolServerProperties.Server files = server("files");
        ToolServerProperties.Server crm = server("crm");
        properties.getServers().addAll(Arrays.asList(files, crm));
        McpSyncClient filesClient = connectedClient();
        McpSyncClient crmClient = connectedClient();
        McpSchema.ListToolsResult filesTools = listing("create_pdf");
        McpSchema.ListToolsResult crmTools = listing("get_customer");
        when(filesClient.listTools()).thenReturn(filesTools);
        when(crmClient.listTools()).thenReturn(crmTools);
        when(crmClient.callTool(any())).thenReturn(text("{\"name\":\"ACME\"}"));
        when(clientFactory.create(same(files), any())).thenReturn(filesClient);
        when(clientFactory.create(same(crm), any())).thenReturn(crmClient);
        McpToolRouter router = router("s-1", "chat-1");

        Assertions.assertEquals("ACME", router.invoke("get_customer", Map.of("id", "7"), TIMEOUT).get("name"));
        Assertions.assertEquals("ACME", router.invoke("get_customer", Map.of("id", "8"), TIMEOUT).get("name"));

        verify(filesClient, times(1)).listTools();
        verify(crmClient, times(1)).listTools();
        verify(crmClient, times(2)).callTool(any());
        verify(filesClient, never()).callTool(any());
    }

    @Test
    public void shouldFailUnknownToolWithToolError() {
        ToolServerProperties.Server files = server("files");
        properties.getServers().add(files);
        McpSyncClient filesClient = connectedClient();
        McpSchema.ListToolsResult filesTools = listing("create_pdf");
        when(filesClient.listTools()).thenReturn(filesTools);
        when(clientFactory.create(same(files), any())).thenReturn(filesClient);
        McpToolRouter router = router("s-1", "chat-1");

        ToolInvocationException ex = Assertions.assertThrows(ToolInvocationException.class,
                () -> router.invoke("launch_rocket", Map.of(), TIMEOUT));

        Assertions.assertEquals(ToolErrorKindEnum.TOOL_ERROR, ex.getKind());
        Assertions.assertTrue(ex.getMessage().contains("launch_rocket"));
        verify(filesClient, never()).callTool(any());
    }

    @Test
    public void shouldMapSlowCallToTimeout() {
        properties.getServers().add(server("workspace", "render_report"));
        McpSyncClient client = connectedClient();
        when(client.callTool(any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return text("{}");
        });
        when(clientFactory.create(any(), any())).thenReturn(client);
        McpToolRouter router = router("s-1", "chat-1");

        long start = System.currentTimeMillis();
        ToolInvocationException ex = Assertions.assertThrows(ToolInvocationException.class,
                () -> router.invoke("render_report", Map.of(), Duration.ofMillis(100)));

        Assertions.assertEquals(ToolErrorKindEnum.TIMEOUT, ex.getKind());
        Assertions.assertTrue(System.currentTimeMillis() - start < 3_000);
    }

    @Test
    public void shouldMapToolReportedErrorsToTypedFailures() {
        properties.getServers().add(server("mail", "send_email", "lookup", "echo", "partial"));
        McpSyncClient client = connectedClient();
        when(client.callTool(any())).thenAnswer(invocation -> {
            McpSchema.CallToolRequest request = invocation.getArgument(0);
            switch (request.name()) {
                case "send_email":
                    return errorText("invalid address");
                case "lookup":
                    return text("{\"error\":\"customer not found\"}");
                case "partial":
                    return text("{\"error\":\"1 row skipped\",\"success\":true,\"rows\":4}");
                default:
                    return text("plain words");
            }
        });
        when(clientFactory.create(any(), any())).thenReturn(client);
        McpToolRouter router = router("s-1", "chat-1");

        ToolInvocationException flagged = Assertions.assertThrows(ToolInvocationException.class,
                () -> router.invoke("send_email", Map.of(), TIMEOUT));
        Assertions.assertEquals(ToolErrorKindEnum.TOOL_ERROR, flagged.getKind());
        Assertions.assertEquals("invalid address", flagged.getMessage());

        ToolInvocationException embedded = Assertions.assertThrows(ToolInvocationException.class,
                () -> router.invoke("lookup", Map.of(), TIMEOUT));
        Assertions.assertEquals(ToolErrorKindEnum.TOOL_ERROR, embedded.getKind());
        Assertions.assertEquals("customer not found", embedded.getMessage());

        Assertions.assertEquals(4, router.invoke("partial", Map.of(), TIMEOUT).get("rows"));
        Assertions.assertEquals("plain words", router.invoke("echo", Map.of(), TIMEOUT).get("result"));
    }

    @Test
    public void shouldRefreshCredentialOnceOnAuthRequired() {
        ToolServerProperties.Server secured = server("secured", "get_machine");
        secured.getAuth().setType(ToolCredentialProvider.AUTH_BEARER);
        secured.getAuth().setToken("static-token");
        properties.getServers().add(secured);
        McpSyncClient stale = connectedClient();
        McpSyncClient fresh = connectedClient();
        when(stale.callTool(any())).thenThrow(new RuntimeException("HTTP 401 Unauthorized"));
        when(fresh.callTool(any())).thenReturn(text("{\"machine\":\"m-1\"}"));
        when(clientFactory.create(same(secured), eq("static-token"))).thenReturn(stale, fresh);
        McpToolRouter router = router("s-1", "chat-1");

        Map<String, Object> result = router.invoke("get_machine", Map.of(), TIMEOUT);

        Assertions.assertEquals("m-1", result.get("machine"));
        verify(clientFactory, times(2)).create(same(secured), eq("static-token"));
        verify(stale).closeGracefully();
    }

    @Test
    public void shouldSurfaceAuthRequiredAfterSingleRefresh() {
        ToolServerProperties.Server secured = server("secured", "get_machine");
        secured.getAuth().setType(ToolCredentialProvider.AUTH_BEARER);
        secured.getAuth().setToken("revoked");
        properties.getServers().add(secured);
        McpSyncClient client = connectedClient();
        when(client.callTool(any())).thenReturn(errorText("token expired"));
        when(clientFactory.create(any(), any())).thenReturn(client);
        McpToolRouter router = router("s-1", "chat-1");

        ToolInvocationException ex = Assertions.assertThrows(ToolInvocationException.class,
                () -> router.invoke("get_machine", Map.of(), TIMEOUT));

        Assertions.assertEquals(ToolErrorKindEnum.AUTH_REQUIRED, ex.getKind());
        verify(client, times(2)).callTool(any());
        verify(clientFactory, times(2)).create(any(), any());
    }

    @Test
    public void shouldNotRetryAuthFailureOnServerWithoutCredentials() {
        properties.getServers().add(server("open", "get_machine"));
        McpSyncClient client = connectedClient();
        when(client.callTool(any())).thenThrow(new RuntimeException("403 Forbidden"));
        when(clientFactory.create(any(), any())).thenReturn(client);
        McpToolRouter router = router("s-1", "chat-1");

        ToolInvocationException ex = Assertions.assertThrows(ToolInvocationException.class,
                () -> router.invoke("get_machine", Map.of(), TIMEOUT));

        Assertions.assertEquals(ToolErrorKindEnum.AUTH_REQUIRED, ex.getKind());
        verify(client, times(1)).callTool(any());
    }

    @Test
    public void shouldObtainTokenFromLoginToolAndSendItAsHeader() {
        ToolServerProperties.Server secured = server("secured", "get_machine");
        secured.getAuth().setType(ToolCredentialProvider.AUTH_LOGIN_TOOL);
        secured.getAuth().setLoginTool("login");
        secured.getAuth().setLoginArguments(new LinkedHashMap<>(Map.of("user", "svc")));
        properties.getServers().add(secured);
        McpSyncClient loginClient = connectedClient();
        McpSyncClient client = connectedClient();
        when(loginClient.callTool(any())).thenReturn(text("{\"data\":{\"token\":\"tok-1\"}}"));
        when(client.callTool(any())).thenReturn(text("{\"machine\":\"m-2\"}"));
        when(clientFactory.create(same(secured), isNull())).thenReturn(loginClient);
        when(clientFactory.create(same(secured), eq("tok-1"))).thenReturn(client);
        McpToolRouter router = router("s-1", "chat-1");

        Assertions.assertEquals("m-2", router.invoke("get_machine", Map.of(), TIMEOUT).get("machine"));

        McpSchema.CallToolRequest login = sentRequests(loginClient, 1).get(0);
        Assertions.assertEquals("login", login.name());
        Assertions.assertEquals("svc", login.arguments().get("user"));
        verify(loginClient).closeGracefully();
    }

    @Test
    public void shouldReconnectAfterUnreachableServer() {
        ToolServerProperties.Server workspace = server("workspace", "search_docs");
        properties.getServers().add(workspace);
        McpSyncClient broken = connectedClient();
        McpSyncClient healthy = connectedClient();
        when(broken.callTool(any())).thenThrow(new RuntimeException("send failed", new ConnectException("refused")));
        when(healthy.callTool(any())).thenReturn(text("{\"hits\":0}"));
        when(clientFactory.create(same(workspace), any())).thenReturn(broken, healthy);
        McpToolRouter router = router("s-1", "chat-1");

        ToolInvocationException ex = Assertions.assertThrows(ToolInvocationException.class,
                () -> router.invoke("search_docs", Map.of(), TIMEOUT));
        Assertions.assertEquals(ToolErrorKindEnum.UNREACHABLE, ex.getKind());

        Assertions.assertEquals(0, router.invoke("search_docs", Map.of(), TIMEOUT).get("hits"));
        verify(clientFactory, times(2)).create(same(workspace), any());
    }

    private McpToolRouter router(String sessionId, String chatId) {
        return new McpToolRouter(sessionId, chatId, properties, clientFactory, new ToolCredentialProvider(properties),
                new ToolErrorClassifier(), new JsonCodec(new ObjectMapper()), toolCallWorker);
    }

    private ToolServerProperties.Server server(String name, String... tools) {
        ToolServerProperties.Server server = new ToolServerProperties.Server();
        server.setName(name);
        server.setUrl("http://127.0.0.1:9/" + name);
        server.setTools(new ArrayList<>(Arrays.asList(tools)));
        return server;
    }

    private McpSyncClient connectedClient() {
        McpSyncClient client = mock(McpSyncClient.class);
        when(client.isInitialized()).thenReturn(true);
        return client;
    }

    private McpSchema.ListToolsResult listing(String toolName) {
        McpSchema.Tool tool = mock(McpSchema.Tool.class);
        when(tool.name()).thenReturn(toolName);
        McpSchema.ListToolsResult result = mock(McpSchema.ListToolsResult.class);
        when(result.tools()).thenReturn(List.of(tool));
        return result;
    }

    private McpSchema.CallToolResult text(String text) {
        return McpSchema.CallToolResult.builder().addTextContent(text).isError(false).build();
    }

    private McpSchema.CallToolResult errorText(String text) {
        return McpSchema.CallToolResult.builder().addTextContent(text).isError(true).build();
    }

    private List<McpSchema.CallToolRequest> sentRequests(McpSyncClient client, int expectedCalls) {
        ArgumentCaptor<McpSchema.CallToolRequest> captor = ArgumentCaptor.forClass(McpSchema.CallToolRequest.class);
        verify(client, times(expectedCalls)).callTool(captor.capture());
        return captor.getAllValues();
    }

    private Map<String, Object> mapOf(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return map;
    }
}
