package com.aris.infrastructure.repository.planning;

import com.aris.domain.planning.adapter.repository.IActionRepository;
import com.aris.domain.planning.model.entity.ActionEntity;
import com.aris.infrastructure.dao.ActionDao;
import com.aris.types.enums.ResponseCode;
import com.aris.types.exception.AppException;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 动作仓储实现类。
 */
@Repository
public class ActionRepositoryImpl implements IActionRepository {

    private final ActionDao actionDao;
    private final ActionPOConverter actionPOConverter;

    public ActionRepositoryImpl(ActionDao actionDao, ActionPOConverter actionPOConverter) {
        this.actionDao = actionDao;
        this.actionPOConverter = actionPOConverter;
    }

    @Override
    public ActionEntity update(ActionEntity action) {
        action.validate();
        int affected = actionDao.update(actionPOConverter.toPO(action));
        if (affected == 0) {
            throw new AppException(ResponseCode.PERSISTENCE_FAILURE, "Action not found for update: " + action.getId());
        }
        return action;
    }

    @Override
    public ActionEntity findById(String actionId) {
        return actionPOConverter.toEntity(actionDao.selectById(actionId));
    }

    @Override
    public List<ActionEntity> findByPlanId(String planId) {
        return actionDao.selectByPlanId(planId).stream()
                .map(actionPOConverter::toEntity)
                .collect(Collectors.toList());
    }
}
