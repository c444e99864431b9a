package com.aris.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 会话记忆条目 DTO。
 */
@Data
public class MemoryEntryDTO {

    private Long id;

    @JsonProperty("chat_id")
    private String chatId;

    private String key;

    private Object value;

    private List<String> tags;

    @JsonProperty("source_tool")
    private String sourceTool;

    @JsonProperty("source_action_id")
    private String sourceActionId;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("last_accessed_at")
    private LocalDateTime lastAccessedAt;

    @JsonProperty("access_count")
    private Integer accessCount;
}
