package com.aris.infrastructure.mcp;

import com.aris.infrastructure.mcp.config.ToolServerProperties;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.spec.McpClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 按工具服务配置构建并初始化 McpSyncClient。
 * <p>
 * 支持 stdio / sse / streamable_http / auto 传输；auto 依次尝试 streamable_http、sse、stdio。
 * </p>
 */
@Slf4j
@Component
public class McpSyncClientFactory {

    static final String TRANSPORT_STDIO = "stdio";
    static final String TRANSPORT_SSE = "sse";
    static final String TRANSPORT_STREAMABLE = "streamable_http";
    static final String TRANSPORT_AUTO = "auto";

    private final ToolServerProperties properties;
    private final McpJsonMapper mcpJsonMapper;

    public McpSyncClientFactory(ToolServerProperties properties) {
        this.properties = properties;
        this.mcpJsonMapper = McpJsonMapper.getDefault();
    }

    /**
     * @param bearerToken 非空时附加 Authorization 头
     */
    public McpSyncClient create(ToolServerProperties.Server server, String bearerToken) {
        String transport = resolveTransport(server);
        if (!TRANSPORT_AUTO.equals(transport)) {
            return build(server, transport, bearerToken);
        }
        RuntimeException lastError = null;
        for (String candidate : new String[]{TRANSPORT_STREAMABLE, TRANSPORT_SSE, TRANSPORT_STDIO}) {
            if (!isConfiguredFor(server, candidate)) {
                continue;
            }
            try {
                return build(server, candidate, bearerToken);
            } catch (RuntimeException ex) {
                log.warn("Failed to create MCP client (server={}, transport={}): {}",
                        server.getName(), candidate, ex.getMessage());
                lastError = ex;
            }
        }
        if (lastError != null) {
            throw lastError;
        }
        throw new IllegalStateException("No usable transport configured for tool server " + server.getName());
    }

    private McpSyncClient build(ToolServerProperties.Server server, String transport, String bearerToken) {
        McpClientTransport clientTransport = buildTransport(server, transport, bearerToken);
        Duration timeout = Duration.ofMillis(properties.getRequestTimeoutMs());
        McpSyncClient client = McpClient.sync(clientTransport)
                .requestTimeout(timeout)
                .initializationTimeout(timeout)
                .clientInfo(new McpSchema.Implementation("aris", "Aris", "1.0"))
                .build();
        try {
            client.initialize();
        } catch (RuntimeException ex) {
            client.closeGracefully();
            throw ex;
        }
        log.info("MCP_CLIENT_READY server={}, transport={}", server.getName(), transport);
        return client;
    }

    private McpClientTransport buildTransport(ToolServerProperties.Server server, String transport, String bearerToken) {
        if (TRANSPORT_STDIO.equals(transport)) {
            return buildStdioTransport(server);
        }
        Map<String, String> headers = new LinkedHashMap<>(server.getHeaders());
        if (StringUtils.isNotBlank(bearerToken)) {
            headers.put("Authorization", "Bearer " + bearerToken);
        }
        Duration connectTimeout = Duration.ofMillis(properties.getConnectTimeoutMs());
        if (TRANSPORT_SSE.equals(transport)) {
            String sseUrl = StringUtils.defaultIfBlank(server.getSseUrl(), server.getUrl());
            if (StringUtils.isBlank(sseUrl)) {
                throw new IllegalStateException("MCP SSE URL is empty");
            }
            HttpClientSseClientTransport.Builder builder = HttpClientSseClientTransport.builder(sseUrl)
                    .jsonMapper(mcpJsonMapper)
                    .connectTimeout(connectTimeout);
            if (!headers.isEmpty()) {
                builder.customizeRequest(requestBuilder -> headers.forEach(requestBuilder::header));
            }
            return builder.build();
        }
        if (TRANSPORT_STREAMABLE.equals(transport)) {
            if (StringUtils.isBlank(server.getUrl())) {
                throw new IllegalStateException("MCP Streamable HTTP endpoint is empty");
            }
            HttpClientStreamableHttpTransport.Builder builder = HttpClientStreamableHttpTransport.builder(server.getUrl())
                    .jsonMapper(mcpJsonMapper)
                    .connectTimeout(connectTimeout);
            if (!headers.isEmpty()) {
                builder.customizeRequest(requestBuilder -> headers.forEach(requestBuilder::header));
            }
            return builder.build();
        }
        throw new IllegalStateException("Unsupported MCP transport: " + transport);
    }

    private StdioClientTransport buildStdioTransport(ToolServerProperties.Server server) {
        if (StringUtils.isBlank(server.getCommand())) {
            throw new IllegalStateException("MCP stdio command is empty");
        }
        ServerParameters.Builder builder = ServerParameters.builder(server.getCommand());
        if (!server.getArgs().isEmpty()) {
            builder.args(server.getArgs());
        }
        if (!server.getEnv().isEmpty()) {
            builder.env(server.getEnv());
        }
        StdioClientTransport transport = new StdioClientTransport(builder.build(), mcpJsonMapper);
        transport.setStdErrorHandler(stderr -> {
            if (StringUtils.isNotBlank(stderr)) {
                log.warn("MCP stdio stderr server={}: {}", server.getName(), stderr);
            }
        });
        return transport;
    }

    String resolveTransport(ToolServerProperties.Server server) {
        String transport = StringUtils.trimToEmpty(server.getTransport()).toLowerCase(Locale.ROOT);
        switch (transport) {
            case "streamable-http":
            case "streamable":
            case "http":
            case TRANSPORT_STREAMABLE:
                return TRANSPORT_STREAMABLE;
            case TRANSPORT_SSE:
                return TRANSPORT_SSE;
            case TRANSPORT_STDIO:
                return TRANSPORT_STDIO;
            case "":
            case TRANSPORT_AUTO:
                return TRANSPORT_AUTO;
            default:
                return transport;
        }
    }

    private boolean isConfiguredFor(ToolServerProperties.Server server, String transport) {
        if (TRANSPORT_STDIO.equals(transport)) {
            return StringUtils.isNotBlank(server.getCommand());
        }
        if (TRANSPORT_SSE.equals(transport)) {
            return StringUtils.isNotBlank(server.getSseUrl()) || StringUtils.isNotBlank(server.getUrl());
        }
        return StringUtils.isNotBlank(server.getUrl());
    }
}
