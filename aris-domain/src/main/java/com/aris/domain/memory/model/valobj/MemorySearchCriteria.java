package com.aris.domain.memory.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 记忆检索条件，字段之间为 AND 关系。
 * <p>
 * keyPattern 支持 * 与 ? 通配符；不含通配符时按子串匹配。tool 与 source_tool 比较时忽略大小写。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemorySearchCriteria {

    public static final int DEFAULT_LIMIT = 20;

    private String tool;

    private String tag;

    private String keyPattern;

    @Builder.Default
    private int limit = DEFAULT_LIMIT;

    public static MemorySearchCriteria byTag(String tag) {
        return MemorySearchCriteria.builder().tag(tag).build();
    }

    public static MemorySearchCriteria byTool(String tool) {
        return MemorySearchCriteria.builder().tool(tool).build();
    }
}
