package com.aris.domain.template.model.valobj;

import com.aris.domain.memory.model.entity.MemoryEntryEntity;
import com.aris.domain.memory.model.valobj.MemorySearchCriteria;
import com.aris.domain.planning.model.entity.ActionEntity;
import lombok.Builder;
import lombok.Data;

import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * 模板解析上下文：本计划已完成的动作 (按完成顺序) 与当前对话的记忆视图。
 */
@Data
@Builder
public class TemplateContext {

    public static final int DEFAULT_MAX_DEPTH = 32;

    @Builder.Default
    private List<ActionEntity> completedActions = Collections.emptyList();

    /** 按键读取记忆，未命中返回 null */
    private Function<String, MemoryEntryEntity> memoryGet;

    /** 检索记忆，最近写入的在前 */
    private Function<MemorySearchCriteria, List<MemoryEntryEntity>> memorySearch;

    /** 对象/数组嵌入字符串时的序列化方式 */
    private Function<Object, String> valueSerializer;

    @Builder.Default
    private int maxDepth = DEFAULT_MAX_DEPTH;
}
