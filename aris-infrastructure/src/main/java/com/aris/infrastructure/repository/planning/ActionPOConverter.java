package com.aris.infrastructure.repository.planning;

import com.aris.domain.planning.model.entity.ActionEntity;
import com.aris.infrastructure.dao.po.ActionPO;
import com.aris.infrastructure.util.JsonCodec;
import org.springframework.stereotype.Component;

/**
 * 动作 Entity 与 PO 的转换，JSONB 字段在此序列化/反序列化。
 */
@Component
public class ActionPOConverter {

    private final JsonCodec jsonCodec;

    public ActionPOConverter(JsonCodec jsonCodec) {
        this.jsonCodec = jsonCodec;
    }

    public ActionEntity toEntity(ActionPO po) {
        if (po == null) {
            return null;
        }
        ActionEntity entity = new ActionEntity();
        entity.setId(po.getId());
        entity.setPlanId(po.getPlanId());
        entity.setOrderIndex(po.getOrderIndex());
        entity.setAlias(po.getAlias());
        entity.setToolName(po.getToolName());
        entity.setArguments(jsonCodec.readObject(po.getArgumentsJson()));
        entity.setResolvedArguments(jsonCodec.readObject(po.getResolvedArgumentsJson()));
        entity.setStatus(po.getStatus());
        entity.setResult(jsonCodec.readObject(po.getResultJson()));
        entity.setError(po.getError());
        entity.setResultVariableName(po.getResultVariableName());
        entity.setStartedAt(po.getStartedAt());
        entity.setCompletedAt(po.getCompletedAt());
        return entity;
    }

    public ActionPO toPO(ActionEntity entity) {
        if (entity == null) {
            return null;
        }
        return ActionPO.builder()
                .id(entity.getId())
                .planId(entity.getPlanId())
                .orderIndex(entity.getOrderIndex())
                .alias(entity.getAlias())
                .toolName(entity.getToolName())
                .argumentsJson(jsonCodec.write(entity.getArguments()))
                .resolvedArgumentsJson(jsonCodec.write(entity.getResolvedArguments()))
                .status(entity.getStatus())
                .resultJson(jsonCodec.write(entity.getResult()))
                .error(entity.getError())
                .resultVariableName(entity.getResultVariableName())
                .startedAt(entity.getStartedAt())
                .completedAt(entity.getCompletedAt())
                .build();
    }
}
