package com.aris.infrastructure.dao.po;

import com.aris.types.enums.PlanStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 执行计划 PO
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanPO {

    /**
     * 主键 ID
     */
    private String id;

    /**
     * 对话 ID (关联 chats.id)
     */
    private String chatId;

    /**
     * 用户请求
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

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
