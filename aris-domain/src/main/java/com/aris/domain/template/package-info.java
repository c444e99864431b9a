/**
 * Template 领域 - 动作间数据依赖
 *
 * <p>把动作参数中的 {@code {{identifier.path}}} 占位符展开为真实值。标识符依次按以下策略解析：</p>
 * <ol>
 *   <li>本计划已完成动作的 ID</li>
 *   <li>动作别名：规划器符号 ID、result_variable_name、工具名、action_N / step_N、previous / last</li>
 *   <li>会话记忆：同名记忆键、由标识符推断的标签 (file / pdf / email ...)、来源工具</li>
 * </ol>
 * <p>全部失败时抛出 {@link com.aris.types.exception.TemplateResolutionException}，并列出已尝试的策略。</p>
 *
 * @author getoffer
 * @since 2025-02-03
 */
package com.aris.domain.template;
