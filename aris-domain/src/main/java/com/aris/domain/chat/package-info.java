/**
 * Chat 领域 - 会话范围
 *
 * <p>Chat 是一次对话的标识，承载该对话下的全部执行计划与会话记忆。
 * 首条客户端消息到达时创建，不会被自动删除。</p>
 *
 * @author getoffer
 * @since 2025-01-30
 */
package com.aris.domain.chat;
