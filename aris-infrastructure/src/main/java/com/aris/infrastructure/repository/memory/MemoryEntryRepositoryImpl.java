package com.aris.infrastructure.repository.memory;

import com.aris.domain.memory.adapter.repository.IMemoryEntryRepository;
import com.aris.domain.memory.model.entity.MemoryEntryEntity;
import com.aris.domain.memory.model.valobj.MemorySearchCriteria;
import com.aris.infrastructure.dao.MemoryEntryDao;
import com.aris.infrastructure.dao.po.MemoryEntryPO;
import com.aris.infrastructure.util.JsonCodec;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 会话记忆仓储实现类。
 * <p>
 * 值与标签以 JSONB 存储；键模式中的 * / ? 转换为 LIKE 的 % / _，不含通配符时按子串匹配。
 * </p>
 */
@Repository
public class MemoryEntryRepositoryImpl implements IMemoryEntryRepository {

    private final MemoryEntryDao memoryEntryDao;
    private final JsonCodec jsonCodec;

    public MemoryEntryRepositoryImpl(MemoryEntryDao memoryEntryDao, JsonCodec jsonCodec) {
        this.memoryEntryDao = memoryEntryDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public MemoryEntryEntity upsert(MemoryEntryEntity entry) {
        entry.validate();
        MemoryEntryPO po = toPO(entry);
        memoryEntryDao.upsert(po);
        entry.setId(po.getId());
        return entry;
    }

    @Override
    public MemoryEntryEntity findByKey(String chatId, String key) {
        return toEntity(memoryEntryDao.selectByKey(chatId, key));
    }

    @Override
    public List<MemoryEntryEntity> search(String chatId, MemorySearchCriteria criteria) {
        String tagJson = StringUtils.isBlank(criteria.getTag())
                ? null
                : jsonCodec.write(Collections.singletonList(criteria.getTag()));
        return memoryEntryDao.search(chatId,
                        StringUtils.trimToNull(criteria.getTool()),
                        tagJson,
                        toLikePattern(criteria.getKeyPattern()),
                        criteria.getLimit()).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public void touch(List<Long> ids, LocalDateTime accessedAt) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        memoryEntryDao.touch(ids, accessedAt);
    }

    private String toLikePattern(String keyPattern) {
        if (StringUtils.isBlank(keyPattern)) {
            return null;
        }
        String escaped = keyPattern.trim()
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        if (!escaped.contains("*") && !escaped.contains("?")) {
            return "%" + escaped + "%";
        }
        return escaped.replace('*', '%').replace('?', '_');
    }

    private MemoryEntryEntity toEntity(MemoryEntryPO po) {
        if (po == null) {
            return null;
        }
        MemoryEntryEntity entity = new MemoryEntryEntity();
        entity.setId(po.getId());
        entity.setChatId(po.getChatId());
        entity.setKey(po.getMemoryKey());
        entity.setValue(jsonCodec.readAny(po.getValueJson()));
        entity.setTags(jsonCodec.readTags(po.getTagsJson()));
        entity.setSourceTool(po.getSourceTool());
        entity.setSourceActionId(po.getSourceActionId());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setLastAccessedAt(po.getLastAccessedAt());
        entity.setAccessCount(po.getAccessCount());
        return entity;
    }

    private MemoryEntryPO toPO(MemoryEntryEntity entity) {
        return MemoryEntryPO.builder()
                .id(entity.getId())
                .chatId(entity.getChatId())
                .memoryKey(entity.getKey())
                .valueJson(jsonCodec.write(entity.getValue()))
                .tagsJson(jsonCodec.write(entity.getTags() == null ? Collections.emptyList() : entity.getTags()))
                .sourceTool(entity.getSourceTool())
                .sourceActionId(entity.getSourceActionId())
                .createdAt(entity.getCreatedAt())
                .lastAccessedAt(entity.getLastAccessedAt())
                .accessCount(entity.getAccessCount() == null ? 0 : entity.getAccessCount())
                .build();
    }
}
