/**
 * Session 领域 - 连接级编排上下文
 *
 * <p>每个客户端连接对应一个相互隔离的会话上下文：对话历史、专属工具路由与会话状态机。
 * 会话之间不共享任何状态。</p>
 *
 * <p>状态机：IDLE（无工具连接）→ INITIALIZING（首条消息触发连接建立）→ ACTIVE（计划执行中）
 * → IDLE（计划之间，连接保持）→ CLOSED（断开）</p>
 *
 * @author getoffer
 * @since 2025-01-30
 */
package com.aris.domain.session;
