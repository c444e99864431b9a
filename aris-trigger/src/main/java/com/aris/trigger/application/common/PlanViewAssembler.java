package com.aris.trigger.application.common;

import com.aris.api.dto.ActionDetailDTO;
import com.aris.api.dto.ActionStatusEventDTO;
import com.aris.api.dto.MemoryEntryDTO;
import com.aris.api.dto.PlanDetailDTO;
import com.aris.api.dto.PlanResultEventDTO;
import com.aris.domain.memory.model.entity.MemoryEntryEntity;
import com.aris.domain.planning.model.entity.ActionEntity;
import com.aris.domain.planning.model.entity.PlanEntity;
import com.aris.domain.planning.model.valobj.ActionProgressEvent;
import com.aris.domain.planning.model.valobj.PlanExecutionResult;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 计划视图组装器：领域对象到出站事件与查询 DTO 的映射。
 */
@Component
public class PlanViewAssembler {

    public ActionStatusEventDTO toStatusEvent(ActionProgressEvent event) {
        if (event == null) {
            return null;
        }
        ActionStatusEventDTO dto = new ActionStatusEventDTO();
        dto.setPlanId(event.getPlanId());
        dto.setActionId(event.getActionId());
        dto.setOrderIndex(event.getOrderIndex());
        dto.setStatus(event.getStatus() == null ? null : event.getStatus().getCode());
        dto.setToolName(event.getToolName());
        dto.setError(event.getError());
        return dto;
    }

    public PlanResultEventDTO toResultEvent(PlanExecutionResult result) {
        if (result == null) {
            return null;
        }
        PlanResultEventDTO dto = new PlanResultEventDTO();
        dto.setPlanId(result.getPlanId());
        dto.setPlanStatus(result.getStatus() == null ? null : result.getStatus().getCode());
        dto.setError(result.getError());
        dto.setActions(toActionDetails(result.getActions()));
        dto.setWarnings(result.getWarnings() == null ? Collections.emptyList() : result.getWarnings());
        return dto;
    }

    public PlanDetailDTO toPlanDetail(PlanEntity plan, List<ActionEntity> actions) {
        if (plan == null) {
            return null;
        }
        PlanDetailDTO dto = new PlanDetailDTO();
        dto.setPlanId(plan.getId());
        dto.setChatId(plan.getChatId());
        dto.setUserQuery(plan.getUserQuery());
        dto.setStatus(plan.getStatus() == null ? null : plan.getStatus().getCode());
        dto.setErrorSummary(plan.getErrorSummary());
        dto.setCreatedAt(plan.getCreatedAt());
        dto.setUpdatedAt(plan.getUpdatedAt());
        dto.setActions(toActionDetails(actions));
        return dto;
    }

    public List<ActionDetailDTO> toActionDetails(List<ActionEntity> actions) {
        if (actions == null || actions.isEmpty()) {
            return Collections.emptyList();
        }
        return actions.stream().map(this::toActionDetail).collect(Collectors.toList());
    }

    public ActionDetailDTO toActionDetail(ActionEntity action) {
        ActionDetailDTO dto = new ActionDetailDTO();
        dto.setActionId(action.getId());
        dto.setPlanId(action.getPlanId());
        dto.setOrderIndex(action.getOrderIndex());
        dto.setAlias(action.getAlias());
        dto.setToolName(action.getToolName());
        dto.setArguments(action.getArguments());
        dto.setResolvedArguments(action.getResolvedArguments());
        dto.setStatus(action.getStatus() == null ? null : action.getStatus().getCode());
        dto.setResult(action.getResult());
        dto.setError(action.getError());
        dto.setResultVariableName(action.getResultVariableName());
        dto.setStartedAt(action.getStartedAt());
        dto.setCompletedAt(action.getCompletedAt());
        return dto;
    }

    public MemoryEntryDTO toMemoryEntry(MemoryEntryEntity entry) {
        if (entry == null) {
            return null;
        }
        MemoryEntryDTO dto = new MemoryEntryDTO();
        dto.setId(entry.getId());
        dto.setChatId(entry.getChatId());
        dto.setKey(entry.getKey());
        dto.setValue(entry.getValue());
        dto.setTags(entry.getTags());
        dto.setSourceTool(entry.getSourceTool());
        dto.setSourceActionId(entry.getSourceActionId());
        dto.setCreatedAt(entry.getCreatedAt());
        dto.setLastAccessedAt(entry.getLastAccessedAt());
        dto.setAccessCount(entry.getAccessCount());
        return dto;
    }
}
