/**
 * Planning 领域 - 计划与动作生命周期
 *
 * <p>职责：计划创建（数据库优先）、动作顺序执行的状态机、执行进度事件</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>执行计划：一次用户请求对应的有序动作序列，创建时连同全部动作一次性落库</li>
 *   <li>动作：一次工具调用，状态 pending → starting → in_progress → completed | failed</li>
 *   <li>快速失败：任一动作失败即中止后续动作，已完成动作及其结果保留</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.aris.domain.planning.model.entity.PlanEntity}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>PlanAssemblyDomainService - 校验规划结果并组装计划与动作实体</li>
 *   <li>PlanTransitionDomainService - 计划/动作状态迁移</li>
 *   <li>PlanDraftParseDomainService - 解析规划器输出的 JSON 草稿</li>
 * </ul>
 *
 * @author getoffer
 * @since 2025-01-30
 */
package com.aris.domain.planning;
