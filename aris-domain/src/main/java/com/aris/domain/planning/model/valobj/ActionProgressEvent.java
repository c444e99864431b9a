package com.aris.domain.planning.model.valobj;

import com.aris.domain.planning.model.entity.ActionEntity;
import com.aris.types.enums.ActionStatusEnum;
import lombok.Builder;
import lombok.Data;

/**
 * 动作状态迁移事件。
 */
@Data
@Builder
public class ActionProgressEvent {

    private String planId;

    private String actionId;

    private Integer orderIndex;

    private String toolName;

    private ActionStatusEnum status;

    private String error;

    public static ActionProgressEvent of(ActionEntity action) {
        return ActionProgressEvent.builder()
                .planId(action.getPlanId())
                .actionId(action.getId())
                .orderIndex(action.getOrderIndex())
                .toolName(action.getToolName())
                .status(action.getStatus())
                .error(action.getError())
                .build();
    }
}
