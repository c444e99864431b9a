package com.aris.test.support;

import com.aris.domain.chat.adapter.repository.IChatRepository;
import com.aris.domain.chat.model.entity.ChatEntity;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存对话仓储。
 */
public class InMemoryChatRepository implements IChatRepository {

    private final Map<String, ChatEntity> store = new ConcurrentHashMap<>();

    @Override
    public ChatEntity ensureExists(String chatId) {
        return store.computeIfAbsent(chatId, id -> {
            ChatEntity chat = new ChatEntity();
            chat.setId(id);
            chat.setCreatedAt(LocalDateTime.now());
            return chat;
        });
    }

    @Override
    public ChatEntity findById(String chatId) {
        return store.get(chatId);
    }
}
