package com.aris.infrastructure.dao;

import com.aris.infrastructure.dao.po.PlanPO;
import com.aris.types.enums.PlanStatusEnum;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 执行计划 DAO
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Mapper
public interface PlanDao {

    /**
     * 插入执行计划
     */
    int insert(PlanPO po);

    /**
     * 状态比较更新：仅当当前状态等于 expectedStatus 时生效
     */
    int updateStatus(@Param("po") PlanPO po, @Param("expectedStatus") PlanStatusEnum expectedStatus);

    /**
     * 根据 ID 查询
     */
    PlanPO selectById(@Param("id") String id);

    /**
     * 根据对话 ID 查询，按创建时间倒序
     */
    List<PlanPO> selectByChatId(@Param("chatId") String chatId);
}
