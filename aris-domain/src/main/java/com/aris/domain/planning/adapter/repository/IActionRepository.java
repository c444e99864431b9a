package com.aris.domain.planning.adapter.repository;

import com.aris.domain.planning.model.entity.ActionEntity;

import java.util.List;

/**
 * 动作仓储接口
 *
 * @author getoffer
 * @since 2025-01-29
 */
public interface IActionRepository {

    /**
     * 持久化一次状态迁移（状态、解析参数、结果、错误、时间戳）。
     */
    ActionEntity update(ActionEntity action);

    ActionEntity findById(String actionId);

    /**
     * 按 order_index 升序。
     */
    List<ActionEntity> findByPlanId(String planId);
}
