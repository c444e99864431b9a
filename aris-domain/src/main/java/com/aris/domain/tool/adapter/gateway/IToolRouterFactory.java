package com.aris.domain.tool.adapter.gateway;

/**
 * 工具路由工厂，为每个会话创建独立的路由实例。
 */
public interface IToolRouterFactory {

    IToolRouter create(String sessionId, String chatId);
}
