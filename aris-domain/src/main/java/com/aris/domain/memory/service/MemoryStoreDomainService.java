package com.aris.domain.memory.service;

import com.aris.domain.memory.adapter.repository.IMemoryEntryRepository;
import com.aris.domain.memory.model.entity.MemoryEntryEntity;
import com.aris.domain.memory.model.valobj.MemorySearchCriteria;
import com.aris.domain.planning.model.entity.ActionEntity;
import com.aris.types.common.Constants;
import com.aris.types.enums.ActionStatusEnum;
import com.aris.types.enums.ResponseCode;
import com.aris.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 会话记忆领域服务：Put / Get / Search，以及动作结果的写入规则。
 *
 * @author getoffer
 * @since 2025-02-03
 */
@Service
public class MemoryStoreDomainService {

    private final IMemoryEntryRepository memoryEntryRepository;
    private final MemoryTagDomainService memoryTagDomainService;

    public MemoryStoreDomainService(IMemoryEntryRepository memoryEntryRepository,
                                    MemoryTagDomainService memoryTagDomainService) {
        this.memoryEntryRepository = memoryEntryRepository;
        this.memoryTagDomainService = memoryTagDomainService;
    }

    public MemoryEntryEntity put(String chatId,
                                 String key,
                                 Object value,
                                 List<String> tags,
                                 String sourceTool,
                                 String sourceActionId) {
        if (StringUtils.isBlank(chatId) || StringUtils.isBlank(key)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "chatId与key不能为空");
        }
        MemoryEntryEntity entry = new MemoryEntryEntity();
        entry.setChatId(chatId);
        entry.setKey(key);
        entry.setValue(value);
        entry.setTags(tags == null ? new ArrayList<>() : new ArrayList<>(tags));
        entry.setSourceTool(sourceTool);
        entry.setSourceActionId(sourceActionId);
        entry.setCreatedAt(LocalDateTime.now());
        entry.setAccessCount(0);
        entry.validate();
        return memoryEntryRepository.upsert(entry);
    }

    /**
     * @return 命中的条目，不存在时返回 null
     */
    public MemoryEntryEntity get(String chatId, String key) {
        if (StringUtils.isBlank(chatId) || StringUtils.isBlank(key)) {
            return null;
        }
        MemoryEntryEntity entry = memoryEntryRepository.findByKey(chatId, key);
        if (entry != null) {
            touch(Collections.singletonList(entry));
        }
        return entry;
    }

    /**
     * 最近写入的在前。
     */
    public List<MemoryEntryEntity> search(String chatId, MemorySearchCriteria criteria) {
        if (StringUtils.isBlank(chatId)) {
            return Collections.emptyList();
        }
        MemorySearchCriteria effective = criteria == null ? new MemorySearchCriteria() : criteria;
        if (effective.getLimit() <= 0) {
            effective.setLimit(MemorySearchCriteria.DEFAULT_LIMIT);
        }
        List<MemoryEntryEntity> entries = memoryEntryRepository.search(chatId, effective);
        if (entries == null || entries.isEmpty()) {
            return Collections.emptyList();
        }
        touch(entries);
        return entries;
    }

    /**
     * 将成功动作的结果写入会话记忆。
     * <p>
     * 设置了 result_variable_name 时以其为键；否则仅在 storeAllResults 开启时以 tool_result_{actionId} 为键。
     * </p>
     *
     * @return 写入的条目，未写入时返回 null
     */
    public MemoryEntryEntity rememberActionResult(String chatId, ActionEntity action, boolean storeAllResults) {
        if (action == null || action.getStatus() != ActionStatusEnum.COMPLETED || action.getResult() == null) {
            return null;
        }
        boolean named = StringUtils.isNotBlank(action.getResultVariableName());
        if (!named && !storeAllResults) {
            return null;
        }
        String key = named ? action.getResultVariableName() : Constants.TOOL_RESULT_KEY_PREFIX + action.getId();
        List<String> tags = memoryTagDomainService.generateTags(
                action.getToolName(),
                action.getResolvedArguments() != null ? action.getResolvedArguments() : action.getArguments(),
                action.getResult(),
                named);
        return put(chatId, key, action.getResult(), tags, action.getToolName(), action.getId());
    }

    private void touch(List<MemoryEntryEntity> entries) {
        LocalDateTime now = LocalDateTime.now();
        List<Long> ids = new ArrayList<>(entries.size());
        for (MemoryEntryEntity entry : entries) {
            if (entry.getId() == null) {
                continue;
            }
            ids.add(entry.getId());
            entry.setLastAccessedAt(now);
            entry.setAccessCount(entry.getAccessCount() == null ? 1 : entry.getAccessCount() + 1);
        }
        if (!ids.isEmpty()) {
            memoryEntryRepository.touch(ids, now);
        }
    }
}
