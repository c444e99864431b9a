package com.aris.domain.session.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 会话历史消息。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatHistoryMessage {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    private String role;

    private String content;
}
