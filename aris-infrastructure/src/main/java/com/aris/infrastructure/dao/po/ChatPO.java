package com.aris.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 对话 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatPO {

    private String id;

    private LocalDateTime createdAt;
}
