package com.aris.domain.planning.model.valobj;

import com.aris.domain.planning.model.entity.ActionEntity;
import com.aris.types.enums.PlanStatusEnum;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 计划执行结果：终态、失败原因与全部动作快照。
 */
@Data
@Builder
public class PlanExecutionResult {

    private String planId;

    private PlanStatusEnum status;

    /** 人类可读的失败原因，成功时为空 */
    private String error;

    /** 失败动作 ID */
    private String failedActionId;

    private List<ActionEntity> actions;

    /** 不影响终态的告警，例如动作结果未能写入会话记忆 */
    private List<String> warnings;
}
