package com.aris.domain.tool.adapter.gateway;

import com.aris.types.exception.ToolInvocationException;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;

/**
 * 工具路由：每个会话一个实例，按工具名把调用分发到对应的远端工具服务。
 */
public interface IToolRouter extends AutoCloseable {

    /**
     * 调用工具。
     *
     * @return 工具结果 (非对象结果包装为 {"result": value})
     * @throws ToolInvocationException 按 Unreachable / AuthRequired / ToolError / Timeout 分类
     */
    Map<String, Object> invoke(String toolName, Map<String, Object> arguments, Duration timeout);

    /**
     * 为即将使用的工具建立连接。已建立的连接保持复用。
     */
    void prepare(Collection<String> toolNames);

    /**
     * 是否已有可用连接。
     */
    boolean isConnected();

    @Override
    void close();
}
