package com.aris.domain.chat.adapter.repository;

import com.aris.domain.chat.model.entity.ChatEntity;

/**
 * 对话仓储接口。
 */
public interface IChatRepository {

    /**
     * 不存在时创建，已存在时直接返回。
     */
    ChatEntity ensureExists(String chatId);

    ChatEntity findById(String chatId);
}
