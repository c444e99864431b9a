package com.aris.infrastructure.dao.po;

import com.aris.types.enums.ActionStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 动作 PO
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionPO {

    private String id;

    /**
     * 计划 ID (关联 plans.id)
     */
    private String planId;

    private Integer orderIndex;

    /**
     * 规划器符号 ID
     */
    private String alias;

    private String toolName;

    /**
     * 原始参数 (JSONB)
     */
    private String argumentsJson;

    /**
     * 解析后参数 (JSONB)
     */
    private String resolvedArgumentsJson;

    private ActionStatusEnum status;

    /**
     * 工具结果 (JSONB)
     */
    private String resultJson;

    private String error;

    private String resultVariableName;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;
}
