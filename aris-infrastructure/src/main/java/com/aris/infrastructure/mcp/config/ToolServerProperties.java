package com.aris.infrastructure.mcp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工具服务注册配置，前缀 aris.tools。
 * <p>
 * 工具名到服务的路由顺序：servers[].tools 静态映射 → 已发现的路由 → default-server → 逐个服务 listTools 发现。
 * default-server 会接收所有未静态映射的工具，因此配置了它就不会再做发现；
 * 需要按工具目录自动路由时留空 default-server。
 * </p>
 *
 * @author getoffer
 * @since 2025-02-04
 */
@Data
@ConfigurationProperties(prefix = "aris.tools")
public class ToolServerProperties {

    /** 工具服务列表 */
    private List<Server> servers = new ArrayList<>();

    /** 未在静态映射中出现的工具默认路由到的服务名 */
    private String defaultServer;

    /** 连接超时 (毫秒)，默认10000 */
    private long connectTimeoutMs = 10_000L;

    /** MCP 请求超时 (毫秒)，默认30000 */
    private long requestTimeoutMs = 30_000L;

    /** 登录凭证缓存时长 (秒)，默认3600 */
    private long tokenCacheTtlSeconds = 3_600L;

    /** 缺少 chat_id 参数时注入当前对话 ID 的工具名 */
    private List<String> chatScopedTools = new ArrayList<>();

    public Server findServer(String name) {
        if (name == null) {
            return null;
        }
        for (Server server : servers) {
            if (name.equals(server.getName())) {
                return server;
            }
        }
        return null;
    }

    @Data
    public static class Server {

        private String name;

        /** streamable_http / sse / stdio / auto */
        private String transport = "auto";

        private String url;

        private String sseUrl;

        private String command;

        private List<String> args = new ArrayList<>();

        private Map<String, String> env = new LinkedHashMap<>();

        private Map<String, String> headers = new LinkedHashMap<>();

        /** 该服务承载的工具名 */
        private List<String> tools = new ArrayList<>();

        /** 工具目录描述，供规划器提示词使用 */
        private Map<String, String> toolDescriptions = new LinkedHashMap<>();

        private Auth auth = new Auth();
    }

    @Data
    public static class Auth {

        /** none / bearer / login-tool */
        private String type = "none";

        /** bearer 模式的静态令牌 */
        private String token;

        /** login-tool 模式下用于换取令牌的工具 */
        private String loginTool;

        private Map<String, Object> loginArguments = new LinkedHashMap<>();

        /** 登录结果中令牌所在字段 */
        private String tokenField = "token";

        /** 设置时令牌注入到工具参数的该字段，而不是 Authorization 头 */
        private String tokenArgument;
    }
}
