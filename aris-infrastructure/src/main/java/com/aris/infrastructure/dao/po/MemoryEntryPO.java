package com.aris.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话记忆 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryEntryPO {

    private Long id;

    private String chatId;

    private String memoryKey;

    /**
     * 值 (JSONB)
     */
    private String valueJson;

    /**
     * 标签 (JSONB 字符串数组)
     */
    private String tagsJson;

    private String sourceTool;

    private String sourceActionId;

    private LocalDateTime createdAt;

    private LocalDateTime lastAccessedAt;

    private Integer accessCount;
}
