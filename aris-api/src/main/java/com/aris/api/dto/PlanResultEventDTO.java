package com.aris.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * 计划终态事件：包含计划最终状态、全部动作明细以及失败原因。
 */
@Data
public class PlanResultEventDTO {

    private String type = "result";

    @JsonProperty("plan_id")
    private String planId;

    @JsonProperty("plan_status")
    private String planStatus;

    private String error;

    private List<ActionDetailDTO> actions;

    /** 结果未写入会话记忆等不改变终态的问题 */
    private List<String> warnings;
}
