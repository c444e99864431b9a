package com.aris.infrastructure.repository.chat;

import com.aris.domain.chat.adapter.repository.IChatRepository;
import com.aris.domain.chat.model.entity.ChatEntity;
import com.aris.infrastructure.dao.ChatDao;
import com.aris.infrastructure.dao.po.ChatPO;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

/**
 * 对话仓储实现类。
 */
@Repository
public class ChatRepositoryImpl implements IChatRepository {

    private final ChatDao chatDao;

    public ChatRepositoryImpl(ChatDao chatDao) {
        this.chatDao = chatDao;
    }

    @Override
    public ChatEntity ensureExists(String chatId) {
        ChatEntity entity = new ChatEntity();
        entity.setId(chatId);
        entity.setCreatedAt(LocalDateTime.now());
        entity.validate();
        chatDao.insertIgnore(ChatPO.builder().id(chatId).createdAt(entity.getCreatedAt()).build());
        ChatEntity stored = findById(chatId);
        return stored != null ? stored : entity;
    }

    @Override
    public ChatEntity findById(String chatId) {
        ChatPO po = chatDao.selectById(chatId);
        if (po == null) {
            return null;
        }
        ChatEntity entity = new ChatEntity();
        entity.setId(po.getId());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
