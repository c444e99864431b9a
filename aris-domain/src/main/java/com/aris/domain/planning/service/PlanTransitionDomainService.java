package com.aris.domain.planning.service;

import com.aris.domain.planning.model.entity.ActionEntity;
import com.aris.domain.planning.model.entity.PlanEntity;
import com.aris.types.enums.ActionStatusEnum;
import com.aris.types.enums.PlanStatusEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Plan 状态推进领域服务：根据动作状态决定 Plan 目标状态并执行迁移。
 */
@Service
public class PlanTransitionDomainService {

    public PlanAggregateStatus resolveAggregateStatus(List<ActionEntity> actions) {
        if (actions == null || actions.isEmpty()) {
            return PlanAggregateStatus.NONE;
        }
        boolean anyStarted = false;
        boolean allCompleted = true;
        for (ActionEntity action : actions) {
            ActionStatusEnum status = action.getStatus();
            if (status == ActionStatusEnum.FAILED) {
                return PlanAggregateStatus.FAILED;
            }
            if (status != ActionStatusEnum.COMPLETED) {
                allCompleted = false;
            }
            if (status != ActionStatusEnum.PENDING) {
                anyStarted = true;
            }
        }
        if (allCompleted) {
            return PlanAggregateStatus.COMPLETED;
        }
        return anyStarted ? PlanAggregateStatus.RUNNING : PlanAggregateStatus.PENDING;
    }

    public PlanStatusEnum resolveTargetStatus(PlanStatusEnum currentStatus, PlanAggregateStatus aggregateStatus) {
        if (currentStatus == null || aggregateStatus == null || currentStatus.isTerminal()) {
            return null;
        }
        return switch (aggregateStatus) {
            case RUNNING -> currentStatus == PlanStatusEnum.NEW ? PlanStatusEnum.IN_PROGRESS : null;
            case COMPLETED -> currentStatus == PlanStatusEnum.IN_PROGRESS ? PlanStatusEnum.COMPLETED : null;
            case FAILED -> PlanStatusEnum.FAILED;
            case PENDING, NONE -> null;
        };
    }

    public void transitPlan(PlanEntity plan, PlanStatusEnum targetStatus, String reason) {
        if (plan == null || targetStatus == null) {
            return;
        }
        if (targetStatus == PlanStatusEnum.IN_PROGRESS) {
            plan.startExecution();
            return;
        }
        if (targetStatus == PlanStatusEnum.COMPLETED) {
            plan.complete();
            return;
        }
        if (targetStatus == PlanStatusEnum.FAILED) {
            plan.fail(StringUtils.defaultIfBlank(reason, "Action failed"));
        }
    }

    /**
     * 生成标识失败动作及原因的用户可见说明。
     */
    public String describeFailure(ActionEntity action) {
        if (action == null) {
            return null;
        }
        return "Action " + (action.getOrderIndex() + 1) + " (" + action.getToolName() + ") failed: "
                + StringUtils.defaultIfBlank(action.getError(), "unknown error");
    }

    public enum PlanAggregateStatus {
        NONE,
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED
    }
}
