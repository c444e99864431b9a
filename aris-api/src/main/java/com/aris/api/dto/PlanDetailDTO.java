package com.aris.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 计划详情 DTO。
 */
@Data
public class PlanDetailDTO {

    @JsonProperty("plan_id")
    private String planId;

    @JsonProperty("chat_id")
    private String chatId;

    @JsonProperty("user_query")
    private String userQuery;

    private String status;

    @JsonProperty("error_summary")
    private String errorSummary;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    private List<ActionDetailDTO> actions;
}
