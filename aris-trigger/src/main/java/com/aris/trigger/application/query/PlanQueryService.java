package com.aris.trigger.application.query;

import com.aris.api.dto.MemoryEntryDTO;
import com.aris.api.dto.PlanDetailDTO;
import com.aris.domain.memory.adapter.repository.IMemoryEntryRepository;
import com.aris.domain.memory.model.entity.MemoryEntryEntity;
import com.aris.domain.memory.model.valobj.MemorySearchCriteria;
import com.aris.domain.planning.adapter.repository.IActionRepository;
import com.aris.domain.planning.adapter.repository.IPlanRepository;
import com.aris.domain.planning.model.entity.PlanEntity;
import com.aris.trigger.application.common.PlanViewAssembler;
import com.aris.types.enums.ResponseCode;
import com.aris.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 计划与会话记忆的只读查询。查询不会更新记忆的访问统计。
 */
@Service
public class PlanQueryService {

    private static final int MAX_MEMORY_LIMIT = 200;

    private final IPlanRepository planRepository;
    private final IActionRepository actionRepository;
    private final IMemoryEntryRepository memoryEntryRepository;
    private final PlanViewAssembler planViewAssembler;

    public PlanQueryService(IPlanRepository planRepository,
                            IActionRepository actionRepository,
                            IMemoryEntryRepository memoryEntryRepository,
                            PlanViewAssembler planViewAssembler) {
        this.planRepository = planRepository;
        this.actionRepository = actionRepository;
        this.memoryEntryRepository = memoryEntryRepository;
        this.planViewAssembler = planViewAssembler;
    }

    public PlanDetailDTO getPlan(String planId) {
        PlanEntity plan = planRepository.findById(planId);
        if (plan == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Plan not found: " + planId);
        }
        return planViewAssembler.toPlanDetail(plan, actionRepository.findByPlanId(planId));
    }

    public List<PlanDetailDTO> listPlans(String chatId) {
        List<PlanDetailDTO> result = new ArrayList<>();
        for (PlanEntity plan : planRepository.findByChatId(chatId)) {
            result.add(planViewAssembler.toPlanDetail(plan, actionRepository.findByPlanId(plan.getId())));
        }
        return result;
    }

    public List<MemoryEntryDTO> searchMemory(String chatId, String tool, String tag, String keyPattern, Integer limit) {
        MemorySearchCriteria criteria = new MemorySearchCriteria();
        criteria.setTool(tool);
        criteria.setTag(tag);
        criteria.setKeyPattern(keyPattern);
        if (limit != null) {
            criteria.setLimit(Math.min(Math.max(limit, 1), MAX_MEMORY_LIMIT));
        }
        List<MemoryEntryDTO> result = new ArrayList<>();
        for (MemoryEntryEntity entry : memoryEntryRepository.search(chatId, criteria)) {
            result.add(planViewAssembler.toMemoryEntry(entry));
        }
        return result;
    }

    public MemoryEntryDTO getMemory(String chatId, String key) {
        MemoryEntryEntity entry = memoryEntryRepository.findByKey(chatId, key);
        if (entry == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Memory entry not found: " + key);
        }
        return planViewAssembler.toMemoryEntry(entry);
    }
}
