package com.aris.domain.memory.adapter.repository;

import com.aris.domain.memory.model.entity.MemoryEntryEntity;
import com.aris.domain.memory.model.valobj.MemorySearchCriteria;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 会话记忆仓储接口
 */
public interface IMemoryEntryRepository {

    /**
     * 按 (chatId, key) 写入，已存在则覆盖值、标签、来源与创建时间。
     */
    MemoryEntryEntity upsert(MemoryEntryEntity entry);

    MemoryEntryEntity findByKey(String chatId, String key);

    /**
     * 按 created_at 倒序。
     */
    List<MemoryEntryEntity> search(String chatId, MemorySearchCriteria criteria);

    /**
     * 访问统计：access_count + 1，last_accessed_at = accessedAt。
     */
    void touch(List<Long> ids, LocalDateTime accessedAt);
}
