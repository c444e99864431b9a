package com.aris.infrastructure.dao;

import com.aris.infrastructure.dao.po.ActionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 动作 DAO
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Mapper
public interface ActionDao {

    /**
     * 批量插入
     */
    int batchInsert(@Param("list") List<ActionPO> list);

    /**
     * 更新状态、解析参数、结果与时间戳
     */
    int update(ActionPO po);

    ActionPO selectById(@Param("id") String id);

    /**
     * 按 order_index 升序
     */
    List<ActionPO> selectByPlanId(@Param("planId") String planId);
}
