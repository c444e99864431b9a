package com.aris.infrastructure.dao;

import com.aris.infrastructure.dao.po.MemoryEntryPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 会话记忆 DAO
 */
@Mapper
public interface MemoryEntryDao {

    /**
     * 按 (chat_id, memory_key) 插入或覆盖
     */
    int upsert(MemoryEntryPO po);

    MemoryEntryPO selectByKey(@Param("chatId") String chatId, @Param("memoryKey") String memoryKey);

    /**
     * 条件检索，按 created_at 倒序
     *
     * @param keyLike 已转换为 LIKE 语法的键模式，可空
     */
    List<MemoryEntryPO> search(@Param("chatId") String chatId,
                               @Param("tool") String tool,
                               @Param("tagJson") String tagJson,
                               @Param("keyLike") String keyLike,
                               @Param("limit") Integer limit);

    int touch(@Param("ids") List<Long> ids, @Param("accessedAt") LocalDateTime accessedAt);
}
