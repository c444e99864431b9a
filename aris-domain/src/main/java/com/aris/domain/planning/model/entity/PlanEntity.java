package com.aris.domain.planning.model.entity;

import com.aris.types.enums.PlanStatusEnum;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 执行计划领域实体
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Data
public class PlanEntity {

    /**
     * 主键 ID
     */
    private String id;

    /**
     * 所属对话 ID
     */
    private String chatId;

    /**
     * 用户原始请求
     */
    private String userQuery;

    /**
     * 状态
     */
    private PlanStatusEnum status;

    /**
     * 错误摘要
     */
    private String errorSummary;

    /**
     * 按 order_index 排列的动作 ID
     */
    private List<String> actionIds = new ArrayList<>();

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;

    /**
     * 验证计划是否有效
     */
    public void validate() {
        if (StringUtils.isBlank(id)) {
            throw new IllegalStateException("Plan ID cannot be empty");
        }
        if (StringUtils.isBlank(chatId)) {
            throw new IllegalStateException("Chat ID cannot be empty");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
    }

    /**
     * 开始执行
     */
    public void startExecution() {
        if (this.status != PlanStatusEnum.NEW) {
            throw new IllegalStateException("Plan must be in NEW status to start execution, current: " + status);
        }
        this.status = PlanStatusEnum.IN_PROGRESS;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 完成执行
     */
    public void complete() {
        if (this.status != PlanStatusEnum.IN_PROGRESS) {
            throw new IllegalStateException("Only in-progress plans can be completed, current: " + status);
        }
        this.status = PlanStatusEnum.COMPLETED;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 标记为失败
     */
    public void fail(String errorSummary) {
        if (this.status == null || this.status.isTerminal()) {
            throw new IllegalStateException("Cannot fail a plan in status " + status);
        }
        this.status = PlanStatusEnum.FAILED;
        this.errorSummary = errorSummary;
        this.updatedAt = LocalDateTime.now();
    }
}
