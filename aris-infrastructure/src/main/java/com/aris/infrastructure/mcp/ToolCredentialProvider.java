package com.aris.infrastructure.mcp;

import com.aris.infrastructure.mcp.config.ToolServerProperties;
import com.aris.types.enums.ToolErrorKindEnum;
import com.aris.types.exception.ToolInvocationException;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * 工具服务凭证提供者。
 * <p>
 * bearer 模式直接使用配置的令牌；login-tool 模式调用登录工具换取令牌，并按服务名缓存。
 * 收到 AuthRequired 时调用 {@link #invalidate(String)}，下次取用时重新获取。
 * </p>
 */
@Slf4j
@Component
public class ToolCredentialProvider {

    public static final String AUTH_NONE = "none";
    public static final String AUTH_BEARER = "bearer";
    public static final String AUTH_LOGIN_TOOL = "login-tool";

    private final Cache<String, String> tokenCache;

    public ToolCredentialProvider(ToolServerProperties properties) {
        this.tokenCache = CacheBuilder.newBuilder()
                .expireAfterWrite(Math.max(properties.getTokenCacheTtlSeconds(), 1L), TimeUnit.SECONDS)
                .build();
    }

    /**
     * @param loginCall 以未认证连接调用登录工具，返回令牌
     * @return 令牌，无需认证时返回 null
     */
    public String resolveToken(ToolServerProperties.Server server, Function<ToolServerProperties.Server, String> loginCall) {
        ToolServerProperties.Auth auth = server.getAuth();
        String type = auth == null ? AUTH_NONE : StringUtils.defaultIfBlank(auth.getType(), AUTH_NONE);
        if (AUTH_BEARER.equalsIgnoreCase(type)) {
            return StringUtils.trimToNull(auth.getToken());
        }
        if (!AUTH_LOGIN_TOOL.equalsIgnoreCase(type)) {
            return null;
        }
        try {
            return tokenCache.get(server.getName(), () -> {
                String token = loginCall.apply(server);
                if (StringUtils.isBlank(token)) {
                    throw new ToolInvocationException(ToolErrorKindEnum.AUTH_REQUIRED, auth.getLoginTool(),
                            "Login tool returned no token for server " + server.getName());
                }
                log.info("TOOL_CREDENTIAL_ISSUED server={}, loginTool={}", server.getName(), auth.getLoginTool());
                return token;
            });
        } catch (ExecutionException | UncheckedExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof ToolInvocationException toolEx) {
                throw toolEx;
            }
            throw new ToolInvocationException(ToolErrorKindEnum.AUTH_REQUIRED, auth.getLoginTool(),
                    "Failed to obtain credential for server " + server.getName() + ": "
                            + (cause == null ? ex.getMessage() : cause.getMessage()), cause);
        }
    }

    public void invalidate(String serverName) {
        if (serverName != null) {
            tokenCache.invalidate(serverName);
        }
    }
}
