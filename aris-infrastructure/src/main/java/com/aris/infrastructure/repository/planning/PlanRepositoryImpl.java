package com.aris.infrastructure.repository.planning;

import com.aris.domain.planning.adapter.repository.IPlanRepository;
import com.aris.domain.planning.model.entity.ActionEntity;
import com.aris.domain.planning.model.entity.PlanEntity;
import com.aris.infrastructure.dao.ActionDao;
import com.aris.infrastructure.dao.PlanDao;
import com.aris.infrastructure.dao.po.ActionPO;
import com.aris.infrastructure.dao.po.PlanPO;
import com.aris.types.enums.PlanStatusEnum;
import com.aris.types.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 执行计划仓储实现类。
 * <p>
 * 负责执行计划的持久化操作，包括：
 * <ul>
 *   <li>计划与全部动作的单事务写入 (数据库优先)</li>
 *   <li>基于当前状态比较的单调状态更新</li>
 *   <li>Entity 与 PO 之间的相互转换</li>
 * </ul>
 * </p>
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Slf4j
@Repository
public class PlanRepositoryImpl implements IPlanRepository {

    private final PlanDao planDao;
    private final ActionDao actionDao;
    private final ActionPOConverter actionPOConverter;

    public PlanRepositoryImpl(PlanDao planDao, ActionDao actionDao, ActionPOConverter actionPOConverter) {
        this.planDao = planDao;
        this.actionDao = actionDao;
        this.actionPOConverter = actionPOConverter;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public PlanEntity saveWithActions(PlanEntity plan, List<ActionEntity> actions) {
        plan.validate();
        actions.forEach(ActionEntity::validate);
        try {
            planDao.insert(toPO(plan));
            List<ActionPO> actionPOs = actions.stream()
                    .map(actionPOConverter::toPO)
                    .collect(Collectors.toList());
            int inserted = actionDao.batchInsert(actionPOs);
            if (inserted != actionPOs.size()) {
                throw new IllegalStateException("Inserted " + inserted + " of " + actionPOs.size() + " actions");
            }
        } catch (RuntimeException ex) {
            log.warn("Failed to persist plan. planId={}, chatId={}, actionCount={}, error={}",
                    plan.getId(), plan.getChatId(), actions.size(), ex.getMessage());
            throw new PersistenceException("Failed to persist plan " + plan.getId() + ": " + ex.getMessage(), ex);
        }
        return plan;
    }

    @Override
    public boolean updateStatus(PlanEntity plan, PlanStatusEnum expectedStatus) {
        return planDao.updateStatus(toPO(plan), expectedStatus) > 0;
    }

    @Override
    public PlanEntity findById(String planId) {
        PlanPO po = planDao.selectById(planId);
        if (po == null) {
            return null;
        }
        PlanEntity entity = toEntity(po);
        entity.setActionIds(actionDao.selectByPlanId(planId).stream()
                .map(ActionPO::getId)
                .collect(Collectors.toList()));
        return entity;
    }

    @Override
    public List<PlanEntity> findByChatId(String chatId) {
        return planDao.selectByChatId(chatId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    /**
     * PO 转换为 Entity
     */
    private PlanEntity toEntity(PlanPO po) {
        PlanEntity entity = new PlanEntity();
        entity.setId(po.getId());
        entity.setChatId(po.getChatId());
        entity.setUserQuery(po.getUserQuery());
        entity.setStatus(po.getStatus());
        entity.setErrorSummary(po.getErrorSummary());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    /**
     * Entity 转换为 PO
     */
    private PlanPO toPO(PlanEntity entity) {
        return PlanPO.builder()
                .id(entity.getId())
                .chatId(entity.getChatId())
                .userQuery(entity.getUserQuery())
                .status(entity.getStatus())
                .errorSummary(entity.getErrorSummary())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
