package com.aris.domain.planning.model.entity;

import com.aris.types.enums.ActionStatusEnum;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 动作领域实体：计划中的一次工具调用。
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Data
public class ActionEntity {

    /**
     * 主键 ID
     */
    private String id;

    /**
     * 所属计划 ID
     */
    private String planId;

    /**
     * 执行顺序 (从 0 开始)
     */
    private Integer orderIndex;

    /**
     * 规划器给出的符号 ID，模板变量可以用它引用本动作
     */
    private String alias;

    /**
     * 工具名
     */
    private String toolName;

    /**
     * 原始参数 (可能包含 {{id.field}} 占位符)
     */
    private Map<String, Object> arguments;

    /**
     * 解析后的参数
     */
    private Map<String, Object> resolvedArguments;

    /**
     * 状态
     */
    private ActionStatusEnum status;

    /**
     * 工具返回结果
     */
    private Map<String, Object> result;

    /**
     * 错误信息
     */
    private String error;

    /**
     * 结果写入会话记忆时使用的键 (可空)
     */
    private String resultVariableName;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    public void validate() {
        if (StringUtils.isBlank(id)) {
            throw new IllegalStateException("Action ID cannot be empty");
        }
        if (StringUtils.isBlank(planId)) {
            throw new IllegalStateException("Plan ID cannot be empty");
        }
        if (orderIndex == null || orderIndex < 0) {
            throw new IllegalStateException("Order index must be non-negative");
        }
        if (StringUtils.isBlank(toolName)) {
            throw new IllegalStateException("Tool name cannot be empty");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
    }

    /**
     * pending → starting
     */
    public void markStarting() {
        if (this.status != ActionStatusEnum.PENDING) {
            throw new IllegalStateException("Action must be PENDING to start, current: " + status);
        }
        this.status = ActionStatusEnum.STARTING;
        this.startedAt = LocalDateTime.now();
    }

    /**
     * starting → in_progress，记录解析后的参数
     */
    public void markInProgress(Map<String, Object> resolvedArguments) {
        if (this.status != ActionStatusEnum.STARTING) {
            throw new IllegalStateException("Action must be STARTING to run, current: " + status);
        }
        this.resolvedArguments = resolvedArguments;
        this.status = ActionStatusEnum.IN_PROGRESS;
    }

    /**
     * in_progress → completed
     */
    public void complete(Map<String, Object> result) {
        if (this.status != ActionStatusEnum.IN_PROGRESS) {
            throw new IllegalStateException("Only in-progress actions can be completed, current: " + status);
        }
        this.result = result;
        this.status = ActionStatusEnum.COMPLETED;
        this.completedAt = LocalDateTime.now();
    }

    /**
     * starting | in_progress → failed
     */
    public void fail(String error) {
        if (this.status != ActionStatusEnum.STARTING && this.status != ActionStatusEnum.IN_PROGRESS) {
            throw new IllegalStateException("Only started actions can fail, current: " + status);
        }
        this.error = error;
        this.status = ActionStatusEnum.FAILED;
        this.completedAt = LocalDateTime.now();
    }
}
