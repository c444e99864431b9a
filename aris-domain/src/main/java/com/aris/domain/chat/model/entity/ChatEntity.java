package com.aris.domain.chat.model.entity;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;

/**
 * 对话领域实体
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Data
public class ChatEntity {

    /**
     * 对话 ID
     */
    private String id;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    public void validate() {
        if (StringUtils.isBlank(id)) {
            throw new IllegalStateException("Chat ID cannot be empty");
        }
    }
}
