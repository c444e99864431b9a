package com.aris.infrastructure.mcp;

import com.aris.types.enums.ToolErrorKindEnum;
import io.modelcontextprotocol.spec.McpError;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * 将 MCP 客户端异常与工具错误文本归类为 {@link ToolErrorKindEnum}。
 */
@Component
public class ToolErrorClassifier {

    private static final List<String> AUTH_MARKERS = List.of("401", "403", "unauthorized", "forbidden",
            "authentication required", "requires authentication", "invalid token", "token expired", "expired token",
            "not authenticated");
    private static final List<String> TIMEOUT_MARKERS = List.of("timeout", "timed out",
            "did not observe any item or terminal signal");
    private static final int MAX_CAUSE_DEPTH = 10;

    public ToolErrorKindEnum classify(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof HttpConnectTimeoutException
                    || current instanceof ConnectException
                    || current instanceof UnknownHostException) {
                return ToolErrorKindEnum.UNREACHABLE;
            }
            if (current instanceof TimeoutException
                    || current instanceof HttpTimeoutException
                    || current instanceof SocketTimeoutException) {
                return ToolErrorKindEnum.TIMEOUT;
            }
            if (isAuthMessage(current.getMessage())) {
                return ToolErrorKindEnum.AUTH_REQUIRED;
            }
            if (current instanceof McpError) {
                return ToolErrorKindEnum.TOOL_ERROR;
            }
            if (current instanceof IOException) {
                return ToolErrorKindEnum.UNREACHABLE;
            }
            if (containsAny(current.getMessage(), TIMEOUT_MARKERS)) {
                return ToolErrorKindEnum.TIMEOUT;
            }
            current = current.getCause();
        }
        return ToolErrorKindEnum.UNREACHABLE;
    }

    /**
     * 工具以 isError 或 {"error": ...} 返回的业务错误。
     */
    public ToolErrorKindEnum classifyToolMessage(String message) {
        return isAuthMessage(message) ? ToolErrorKindEnum.AUTH_REQUIRED : ToolErrorKindEnum.TOOL_ERROR;
    }

    private boolean isAuthMessage(String message) {
        return containsAny(message, AUTH_MARKERS);
    }

    private boolean containsAny(String message, List<String> markers) {
        if (StringUtils.isBlank(message)) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            if (normalized.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
