package com.aris.domain.planning.model.valobj;

import com.aris.domain.planning.model.entity.ActionEntity;
import com.aris.domain.planning.model.entity.PlanEntity;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 待持久化的计划及其全部动作。
 */
@Data
@AllArgsConstructor
public class AssembledPlan {

    private PlanEntity plan;

    private List<ActionEntity> actions;
}
