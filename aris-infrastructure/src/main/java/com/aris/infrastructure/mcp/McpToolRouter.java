package com.aris.infrastructure.mcp;

import com.aris.domain.tool.adapter.gateway.IToolRouter;
import com.aris.infrastructure.mcp.config.ToolServerProperties;
import com.aris.infrastructure.util.JsonCodec;
import com.aris.types.enums.ToolErrorKindEnum;
import com.aris.types.exception.AppException;
import com.aris.types.exception.ToolInvocationException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 会话级 MCP 工具路由。
 * <p>
 * 每个会话持有各自的客户端连接，按服务名懒加载并复用；会话关闭时统一释放。
 * 调用超时由工具线程池上的 {@link Future#get(long, TimeUnit)} 控制。
 * 收到 AuthRequired 时刷新凭证并重试一次。
 * </p>
 */
@Slf4j
public class McpToolRouter implements IToolRouter {

    private static final String METRIC_AUTH_REFRESH = "aris.tool.auth.refresh";
    private static final String CHAT_ID_ARGUMENT = "chat_id";
    private static final String RESULT_FIELD = "result";
    /** 规划器在不知道真实对话 ID 时写入的占位值 */
    private static final Set<String> CHAT_ID_PLACEHOLDERS = Set.of("current_chat", "current_session");

    private final String sessionId;
    private final String chatId;
    private final ToolServerProperties properties;
    private final McpSyncClientFactory clientFactory;
    private final ToolCredentialProvider credentialProvider;
    private final ToolErrorClassifier errorClassifier;
    private final JsonCodec jsonCodec;
    private final ExecutorService toolCallExecutor;
    private final MeterRegistry meterRegistry;

    private final ConcurrentMap<String, ManagedClient> clients = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> discoveredRoutes = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public McpToolRouter(String sessionId,
                         String chatId,
                         ToolServerProperties properties,
                         McpSyncClientFactory clientFactory,
                         ToolCredentialProvider credentialProvider,
                         ToolErrorClassifier errorClassifier,
                         JsonCodec jsonCodec,
                         ExecutorService toolCallExecutor) {
        this.sessionId = sessionId;
        this.chatId = chatId;
        this.properties = properties;
        this.clientFactory = clientFactory;
        this.credentialProvider = credentialProvider;
        this.errorClassifier = errorClassifier;
        this.jsonCodec = jsonCodec;
        this.toolCallExecutor = toolCallExecutor;
        this.meterRegistry = Metrics.globalRegistry;
    }

    @Override
    public Map<String, Object> invoke(String toolName, Map<String, Object> arguments, Duration timeout) {
        if (closed.get()) {
            throw new ToolInvocationException(ToolErrorKindEnum.UNREACHABLE, toolName,
                    "Tool router of session " + sessionId + " is closed");
        }
        ToolServerProperties.Server server = resolveServer(toolName);
        if (server == null) {
            throw new ToolInvocationException(ToolErrorKindEnum.TOOL_ERROR, toolName, "Unknown tool: " + toolName);
        }
        Map<String, Object> effectiveArguments = bindChatId(toolName, arguments);
        long timeoutMs = timeout == null || timeout.isNegative() || timeout.isZero()
                ? properties.getRequestTimeoutMs() : timeout.toMillis();
        try {
            return callOnce(server, toolName, effectiveArguments, timeoutMs);
        } catch (ToolInvocationException ex) {
            if (ex.getKind() != ToolErrorKindEnum.AUTH_REQUIRED || !requiresCredential(server)) {
                throw ex;
            }
            log.info("TOOL_AUTH_REFRESH sessionId={}, server={}, tool={}", sessionId, server.getName(), toolName);
            meterRegistry.counter(METRIC_AUTH_REFRESH, "server", server.getName()).increment();
            credentialProvider.invalidate(server.getName());
            evict(server.getName());
            return callOnce(server, toolName, effectiveArguments, timeoutMs);
        }
    }

    /**
     * 对声明了 chat_id 的工具补齐缺失值；任何工具上的占位值都替换为本会话的对话 ID。
     */
    private Map<String, Object> bindChatId(String toolName, Map<String, Object> arguments) {
        Map<String, Object> bound = arguments == null ? new LinkedHashMap<>() : new LinkedHashMap<>(arguments);
        Object current = bound.get(CHAT_ID_ARGUMENT);
        boolean missing = current == null || (current instanceof String text && StringUtils.isBlank(text));
        boolean placeholder = current instanceof String text
                && CHAT_ID_PLACEHOLDERS.contains(text.trim().toLowerCase(Locale.ROOT));
        if (placeholder || (missing && properties.getChatScopedTools().contains(toolName))) {
            bound.put(CHAT_ID_ARGUMENT, chatId);
        }
        return bound;
    }

    @Override
    public void prepare(Collection<String> toolNames) {
        if (toolNames == null || closed.get()) {
            return;
        }
        for (String toolName : new LinkedHashSet<>(toolNames)) {
            ToolServerProperties.Server server = resolveServer(toolName);
            if (server == null) {
                continue;
            }
            try {
                getOrCreateClient(server, toolName);
            } catch (ToolInvocationException ex) {
                log.warn("Failed to prepare tool connection sessionId={}, server={}, tool={}, error={}",
                        sessionId, server.getName(), toolName, ex.getMessage());
            }
        }
    }

    @Override
    public boolean isConnected() {
        return !closed.get() && !clients.isEmpty();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int count = clients.size();
        for (ManagedClient client : clients.values()) {
            client.close();
        }
        clients.clear();
        log.info("TOOL_ROUTER_CLOSED sessionId={}, chatId={}, clients={}", sessionId, chatId, count);
    }

    private Map<String, Object> callOnce(ToolServerProperties.Server server,
                                         String toolName,
                                         Map<String, Object> arguments,
                                         long timeoutMs) {
        ManagedClient managed = getOrCreateClient(server, toolName);
        Map<String, Object> callArguments = new LinkedHashMap<>(arguments);
        String tokenArgument = server.getAuth() == null ? null : server.getAuth().getTokenArgument();
        if (StringUtils.isNotBlank(tokenArgument) && managed.token != null) {
            callArguments.put(tokenArgument, managed.token);
        }
        Future<McpSchema.CallToolResult> future;
        try {
            future = toolCallExecutor.submit(() -> managed.client.callTool(new McpSchema.CallToolRequest(toolName, callArguments)));
        } catch (RejectedExecutionException ex) {
            throw new ToolInvocationException(ToolErrorKindEnum.UNREACHABLE, toolName,
                    "Tool call rejected: worker pool saturated", ex);
        }
        McpSchema.CallToolResult result;
        try {
            result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new ToolInvocationException(ToolErrorKindEnum.TIMEOUT, toolName,
                    "Tool " + toolName + " did not respond within " + timeoutMs + "ms", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ToolInvocationException(ToolErrorKindEnum.UNREACHABLE, toolName, "Tool call interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            ToolErrorKindEnum kind = errorClassifier.classify(cause);
            if (kind == ToolErrorKindEnum.UNREACHABLE) {
                evict(server.getName());
            }
            throw new ToolInvocationException(kind, toolName, StringUtils.defaultIfBlank(cause.getMessage(),
                    cause.getClass().getSimpleName()), cause);
        }
        return toResultMap(toolName, result);
    }

    private ManagedClient getOrCreateClient(ToolServerProperties.Server server, String toolName) {
        ManagedClient existing = clients.get(server.getName());
        if (existing != null && existing.isAvailable()) {
            return existing;
        }
        try {
            return clients.compute(server.getName(), (key, current) -> {
                if (current != null && current.isAvailable()) {
                    return current;
                }
                if (current != null) {
                    current.close();
                }
                return createClient(server);
            });
        } catch (ToolInvocationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            ToolErrorKindEnum kind = errorClassifier.classify(ex);
            throw new ToolInvocationException(kind, toolName,
                    "Failed to connect tool server " + server.getName() + ": " + ex.getMessage(), ex);
        }
    }

    private ManagedClient createClient(ToolServerProperties.Server server) {
        String token = credentialProvider.resolveToken(server, this::login);
        boolean headerAuth = server.getAuth() == null || StringUtils.isBlank(server.getAuth().getTokenArgument());
        McpSyncClient client = clientFactory.create(server, headerAuth ? token : null);
        log.info("SESSION_TOOL_CONNECTED sessionId={}, server={}, authenticated={}",
                sessionId, server.getName(), token != null);
        return new ManagedClient(server.getName(), client, token);
    }

    /**
     * 以未认证连接调用登录工具换取令牌。
     */
    private String login(ToolServerProperties.Server server) {
        ToolServerProperties.Auth auth = server.getAuth();
        McpSyncClient transientClient = clientFactory.create(server, null);
        try {
            McpSchema.CallToolResult result = transientClient.callTool(
                    new McpSchema.CallToolRequest(auth.getLoginTool(), new LinkedHashMap<>(auth.getLoginArguments())));
            Map<String, Object> payload = toResultMap(auth.getLoginTool(), result);
            return extractToken(payload, auth.getTokenField());
        } finally {
            transientClient.closeGracefully();
        }
    }

    @SuppressWarnings("unchecked")
    private String extractToken(Map<String, Object> payload, String tokenField) {
        String field = StringUtils.defaultIfBlank(tokenField, "token");
        Object token = payload.get(field);
        if (token == null && payload.get("data") instanceof Map<?, ?>) {
            token = ((Map<String, Object>) payload.get("data")).get(field);
        }
        if (token == null && payload.get(RESULT_FIELD) instanceof String) {
            token = payload.get(RESULT_FIELD);
        }
        return token == null ? null : String.valueOf(token);
    }

    /**
     * 静态映射 → 已发现路由 → default-server → listTools 发现。配置了 default-server 时不做发现。
     */
    private ToolServerProperties.Server resolveServer(String toolName) {
        if (StringUtils.isBlank(toolName)) {
            return null;
        }
        for (ToolServerProperties.Server server : properties.getServers()) {
            if (server.getTools().contains(toolName)) {
                return server;
            }
        }
        String discovered = discoveredRoutes.get(toolName);
        if (discovered != null) {
            return properties.findServer(discovered);
        }
        ToolServerProperties.Server defaultServer = properties.findServer(properties.getDefaultServer());
        if (defaultServer != null) {
            return defaultServer;
        }
        return discover(toolName);
    }

    private ToolServerProperties.Server discover(String toolName) {
        for (ToolServerProperties.Server server : properties.getServers()) {
            try {
                ManagedClient managed = getOrCreateClient(server, toolName);
                McpSchema.ListToolsResult listed = managed.client.listTools();
                if (listed == null || listed.tools() == null) {
                    continue;
                }
                for (McpSchema.Tool tool : listed.tools()) {
                    discoveredRoutes.putIfAbsent(tool.name(), server.getName());
                }
                if (server.getName().equals(discoveredRoutes.get(toolName))) {
                    log.info("TOOL_ROUTE_DISCOVERED sessionId={}, tool={}, server={}", sessionId, toolName, server.getName());
                    return server;
                }
            } catch (RuntimeException ex) {
                log.warn("Failed to list tools sessionId={}, server={}, error={}", sessionId, server.getName(), ex.getMessage());
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toResultMap(String toolName, McpSchema.CallToolResult result) {
        String text = collectText(result);
        if (result != null && Boolean.TRUE.equals(result.isError())) {
            throw new ToolInvocationException(errorClassifier.classifyToolMessage(text), toolName,
                    StringUtils.defaultIfBlank(text, "Tool reported an error"));
        }
        Object parsed = parseText(text);
        if (parsed instanceof Map<?, ?>) {
            Map<String, Object> map = new LinkedHashMap<>((Map<String, Object>) parsed);
            Object error = map.get("error");
            if (error != null && !Boolean.TRUE.equals(map.get("success"))) {
                String message = String.valueOf(error);
                throw new ToolInvocationException(errorClassifier.classifyToolMessage(message), toolName, message);
            }
            return map;
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put(RESULT_FIELD, parsed);
        return wrapped;
    }

    private String collectText(McpSchema.CallToolResult result) {
        if (result == null || result.content() == null) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (McpSchema.Content content : result.content()) {
            if (content instanceof McpSchema.TextContent textContent && textContent.text() != null) {
                if (text.length() > 0) {
                    text.append('\n');
                }
                text.append(textContent.text());
            }
        }
        return text.length() == 0 ? null : text.toString();
    }

    private Object parseText(String text) {
        if (StringUtils.isBlank(text)) {
            return text;
        }
        String trimmed = text.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return text;
        }
        try {
            return jsonCodec.readAny(trimmed);
        } catch (AppException ex) {
            return text;
        }
    }

    private boolean requiresCredential(ToolServerProperties.Server server) {
        ToolServerProperties.Auth auth = server.getAuth();
        return auth != null && !ToolCredentialProvider.AUTH_NONE.equalsIgnoreCase(
                StringUtils.defaultIfBlank(auth.getType(), ToolCredentialProvider.AUTH_NONE));
    }

    private void evict(String serverName) {
        ManagedClient removed = clients.remove(serverName);
        if (removed != null) {
            removed.close();
        }
    }

    private static final class ManagedClient {

        private final String serverName;
        private final McpSyncClient client;
        private final String token;

        private ManagedClient(String serverName, McpSyncClient client, String token) {
            this.serverName = serverName;
            this.client = client;
            this.token = token;
        }

        private boolean isAvailable() {
            return client.isInitialized();
        }

        private void close() {
            try {
                client.closeGracefully();
            } catch (Exception ex) {
                log.warn("Failed to close MCP client server={}: {}", serverName, ex.getMessage());
            }
        }
    }
}
