package com.aris.domain.memory.model.entity;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 会话记忆条目领域实体
 *
 * @author getoffer
 * @since 2025-02-03
 */
@Data
public class MemoryEntryEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 对话 ID
     */
    private String chatId;

    /**
     * 记忆键 (对话内唯一)
     */
    private String key;

    /**
     * 值 (任意 JSON)
     */
    private Object value;

    /**
     * 语义标签
     */
    private List<String> tags = new ArrayList<>();

    /**
     * 来源工具
     */
    private String sourceTool;

    /**
     * 来源动作 ID
     */
    private String sourceActionId;

    private LocalDateTime createdAt;

    private LocalDateTime lastAccessedAt;

    private Integer accessCount;

    public void validate() {
        if (StringUtils.isBlank(chatId)) {
            throw new IllegalStateException("Chat ID cannot be empty");
        }
        if (StringUtils.isBlank(key)) {
            throw new IllegalStateException("Memory key cannot be empty");
        }
        if (value == null) {
            throw new IllegalStateException("Memory value cannot be null");
        }
    }

    public boolean hasTag(String tag) {
        return tags != null && tag != null && tags.contains(tag);
    }
}
