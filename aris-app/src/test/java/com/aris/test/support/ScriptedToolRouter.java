package com.aris.test.support;

import com.aris.domain.tool.adapter.gateway.IToolRouter;
import com.aris.types.enums.ToolErrorKindEnum;
import com.aris.types.exception.ToolInvocationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * 按工具名预置响应的工具路由，记录每次调用的参数。
 */
public class ScriptedToolRouter implements IToolRouter {

    private final Map<String, Function<Map<String, Object>, Map<String, Object>>> handlers = new ConcurrentHashMap<>();
    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private final List<String> prepared = new CopyOnWriteArrayList<>();
    private volatile Runnable prepareHook;
    private volatile long latencyMs;
    private volatile boolean connected;
    private volatile boolean closed;

    public ScriptedToolRouter on(String toolName, Function<Map<String, Object>, Map<String, Object>> handler) {
        handlers.put(toolName, handler);
        return this;
    }

    public ScriptedToolRouter returning(String toolName, Map<String, Object> result) {
        return on(toolName, args -> new LinkedHashMap<>(result));
    }

    public ScriptedToolRouter failing(String toolName, ToolErrorKindEnum kind, String detail) {
        return on(toolName, args -> {
            throw new ToolInvocationException(kind, toolName, detail);
        });
    }

    /**
     * 建立连接时执行的附加动作，例如模拟此刻断开连接。
     */
    public ScriptedToolRouter onPrepare(Runnable hook) {
        this.prepareHook = hook;
        return this;
    }

    public ScriptedToolRouter withLatency(long latencyMs) {
        this.latencyMs = latencyMs;
        return this;
    }

    @Override
    public Map<String, Object> invoke(String toolName, Map<String, Object> arguments, Duration timeout) {
        calls.add(new Call(toolName, arguments == null ? Collections.emptyMap() : new LinkedHashMap<>(arguments)));
        if (latencyMs > 0) {
            try {
                Thread.sleep(latencyMs);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new ToolInvocationException(ToolErrorKindEnum.UNREACHABLE, toolName, "interrupted");
            }
        }
        Function<Map<String, Object>, Map<String, Object>> handler = handlers.get(toolName);
        if (handler == null) {
            throw new ToolInvocationException(ToolErrorKindEnum.TOOL_ERROR, toolName, "Unknown tool: " + toolName);
        }
        return handler.apply(arguments);
    }

    @Override
    public void prepare(Collection<String> toolNames) {
        prepared.addAll(toolNames);
        connected = true;
        Runnable hook = prepareHook;
        if (hook != null) {
            hook.run();
        }
    }

    @Override
    public boolean isConnected() {
        return connected && !closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public List<Call> calls() {
        return new ArrayList<>(calls);
    }

    public List<String> prepared() {
        return new ArrayList<>(prepared);
    }

    public static final class Call {

        private final String toolName;
        private final Map<String, Object> arguments;

        Call(String toolName, Map<String, Object> arguments) {
            this.toolName = toolName;
            this.arguments = arguments;
        }

        public String toolName() {
            return toolName;
        }

        public Map<String, Object> arguments() {
            return arguments;
        }
    }
}
