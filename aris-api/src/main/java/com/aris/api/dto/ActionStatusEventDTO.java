package com.aris.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * 动作状态事件，每次动作状态迁移时推送。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionStatusEventDTO {

    private String type = "status";

    @JsonProperty("plan_id")
    private String planId;

    @JsonProperty("action_id")
    private String actionId;

    @JsonProperty("order_index")
    private Integer orderIndex;

    private String status;

    @JsonProperty("tool_name")
    private String toolName;

    private String error;
}
