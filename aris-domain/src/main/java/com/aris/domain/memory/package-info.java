/**
 * Memory 领域 - 对话级会话记忆
 *
 * <p>按 chat 隔离的持久化键值存储，保存成功动作的结果及语义标签，可按工具名、标签或键模式检索。
 * 同一对话的后续计划通过它引用先前计划产出的结果。</p>
 *
 * <ul>
 *   <li>同键写入覆盖旧值</li>
 *   <li>只记录成功结果，失败从不缓存</li>
 *   <li>检索结果按写入时间倒序，命中时更新访问统计</li>
 * </ul>
 *
 * @author getoffer
 * @since 2025-02-03
 */
package com.aris.domain.memory;
