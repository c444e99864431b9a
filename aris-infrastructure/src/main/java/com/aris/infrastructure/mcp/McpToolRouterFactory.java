package com.aris.infrastructure.mcp;

import com.aris.domain.tool.adapter.gateway.IToolRouter;
import com.aris.domain.tool.adapter.gateway.IToolRouterFactory;
import com.aris.infrastructure.mcp.config.ToolServerProperties;
import com.aris.infrastructure.util.JsonCodec;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 为每个会话创建独立的 {@link McpToolRouter}。
 */
@Component
public class McpToolRouterFactory implements IToolRouterFactory {

    private final ToolServerProperties properties;
    private final McpSyncClientFactory clientFactory;
    private final ToolCredentialProvider credentialProvider;
    private final ToolErrorClassifier errorClassifier;
    private final JsonCodec jsonCodec;
    private final ThreadPoolExecutor toolCallWorker;

    public McpToolRouterFactory(ToolServerProperties properties,
                                McpSyncClientFactory clientFactory,
                                ToolCredentialProvider credentialProvider,
                                ToolErrorClassifier errorClassifier,
                                JsonCodec jsonCodec,
                                @Qualifier("toolCallWorker") ThreadPoolExecutor toolCallWorker) {
        this.properties = properties;
        this.clientFactory = clientFactory;
        this.credentialProvider = credentialProvider;
        this.errorClassifier = errorClassifier;
        this.jsonCodec = jsonCodec;
        this.toolCallWorker = toolCallWorker;
    }

    @Override
    public IToolRouter create(String sessionId, String chatId) {
        return new McpToolRouter(sessionId, chatId, properties, clientFactory, credentialProvider,
                errorClassifier, jsonCodec, toolCallWorker);
    }
}
