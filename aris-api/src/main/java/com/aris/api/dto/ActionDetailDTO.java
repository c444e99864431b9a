package com.aris.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 动作详情 DTO。
 */
@Data
public class ActionDetailDTO {

    @JsonProperty("action_id")
    private String actionId;

    @JsonProperty("plan_id")
    private String planId;

    @JsonProperty("order_index")
    private Integer orderIndex;

    private String alias;

    @JsonProperty("tool_name")
    private String toolName;

    private Map<String, Object> arguments;

    @JsonProperty("resolved_arguments")
    private Map<String, Object> resolvedArguments;

    private String status;

    private Map<String, Object> result;

    private String error;

    @JsonProperty("result_variable_name")
    private String resultVariableName;

    @JsonProperty("started_at")
    private LocalDateTime startedAt;

    @JsonProperty("completed_at")
    private LocalDateTime completedAt;
}
