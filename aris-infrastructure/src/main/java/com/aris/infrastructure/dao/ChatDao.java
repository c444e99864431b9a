package com.aris.infrastructure.dao;

import com.aris.infrastructure.dao.po.ChatPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 对话 DAO
 */
@Mapper
public interface ChatDao {

    /**
     * 插入对话，已存在时忽略
     */
    int insertIgnore(ChatPO po);

    ChatPO selectById(@Param("id") String id);
}
