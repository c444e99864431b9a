package com.aris.domain.planning.service;

import com.aris.domain.planning.model.entity.ActionEntity;
import com.aris.domain.planning.model.entity.PlanEntity;
import com.aris.domain.planning.model.valobj.AssembledPlan;
import com.aris.domain.planning.model.valobj.PlannedAction;
import com.aris.types.enums.ActionStatusEnum;
import com.aris.types.enums.PlanStatusEnum;
import com.aris.types.enums.ResponseCode;
import com.aris.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * 计划组装领域服务：校验规划结果，生成计划与 pending 动作实体。
 */
@Service
public class PlanAssemblyDomainService {

    private static final int MAX_ALIAS_LENGTH = 128;

    public AssembledPlan assemble(String chatId, String userQuery, List<PlannedAction> plannedActions) {
        if (StringUtils.isBlank(chatId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "chatId不能为空");
        }
        if (plannedActions == null || plannedActions.isEmpty()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "计划至少需要一个动作");
        }

        LocalDateTime now = LocalDateTime.now();
        PlanEntity plan = new PlanEntity();
        plan.setId(UUID.randomUUID().toString());
        plan.setChatId(chatId);
        plan.setUserQuery(StringUtils.defaultString(userQuery));
        plan.setStatus(PlanStatusEnum.NEW);
        plan.setCreatedAt(now);
        plan.setUpdatedAt(now);

        List<ActionEntity> actions = new ArrayList<>(plannedActions.size());
        Set<String> seenAliases = new HashSet<>();
        for (int i = 0; i < plannedActions.size(); i++) {
            PlannedAction planned = plannedActions.get(i);
            if (planned == null || StringUtils.isBlank(planned.getToolName())) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "第" + (i + 1) + "个动作的工具名不能为空");
            }
            ActionEntity action = new ActionEntity();
            action.setId(UUID.randomUUID().toString());
            action.setPlanId(plan.getId());
            action.setOrderIndex(i);
            action.setAlias(normalizeAlias(planned.getId(), seenAliases));
            action.setToolName(planned.getToolName().trim());
            action.setArguments(planned.getArguments() == null
                    ? new LinkedHashMap<>()
                    : new LinkedHashMap<>(planned.getArguments()));
            action.setResultVariableName(StringUtils.trimToNull(planned.getResultVariableName()));
            action.setStatus(ActionStatusEnum.PENDING);
            action.validate();
            actions.add(action);
            plan.getActionIds().add(action.getId());
        }
        plan.validate();
        return new AssembledPlan(plan, actions);
    }

    private String normalizeAlias(String alias, Set<String> seenAliases) {
        String trimmed = StringUtils.trimToNull(alias);
        if (trimmed == null || trimmed.length() > MAX_ALIAS_LENGTH) {
            return null;
        }
        // 同一计划内重复的符号 ID 只保留第一个
        return seenAliases.add(trimmed) ? trimmed : null;
    }
}
