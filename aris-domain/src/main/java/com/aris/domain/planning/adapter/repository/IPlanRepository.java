package com.aris.domain.planning.adapter.repository;

import com.aris.domain.planning.model.entity.ActionEntity;
import com.aris.domain.planning.model.entity.PlanEntity;
import com.aris.types.enums.PlanStatusEnum;

import java.util.List;

/**
 * 执行计划仓储接口
 *
 * @author getoffer
 * @since 2025-01-29
 */
public interface IPlanRepository {

    /**
     * 在同一事务中写入计划及全部动作，任何一条失败则整体回滚。
     *
     * @throws com.aris.types.exception.PersistenceException 写入失败
     */
    PlanEntity saveWithActions(PlanEntity plan, List<ActionEntity> actions);

    /**
     * 仅当数据库中的状态仍为 expectedStatus 时更新状态与错误摘要。
     *
     * @return 是否更新成功
     */
    boolean updateStatus(PlanEntity plan, PlanStatusEnum expectedStatus);

    PlanEntity findById(String planId);

    /**
     * 按创建时间倒序。
     */
    List<PlanEntity> findByChatId(String chatId);
}
