/**
 * Tool 领域 - 工具调用契约
 *
 * <p>工具路由按工具名把调用分发到远端工具服务；本域定义路由端口、结果信封与重试策略。
 * Unreachable / Timeout 按指数退避有限次重试，ToolError 不重试，AuthRequired 由路由内部刷新凭证后重试一次。</p>
 *
 * @author getoffer
 * @since 2025-02-03
 */
package com.aris.domain.tool;
