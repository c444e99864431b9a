package com.aris.domain.planning.service;

import com.aris.domain.planning.model.valobj.PlannedAction;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 规划草稿解析领域服务：从模型输出中提取 JSON 并转换为动作草稿。
 */
@Service
public class PlanDraftParseDomainService {

    public Map<String, Object> parseEmbeddedJsonObject(String text,
                                                       Function<String, Map<String, Object>> strictParser) {
        if (isBlank(text) || strictParser == null) {
            return null;
        }

        String trimmed = text.trim();
        Map<String, Object> parsed = parseStrict(trimmed, strictParser);
        if (parsed != null) {
            return parsed;
        }

        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return parseStrict(trimmed.substring(start, end + 1), strictParser);
    }

    /**
     * 读取 {"actions":[{"id","tool_name","arguments","result_variable_name"}]}，兼容 camelCase 字段名。
     */
    @SuppressWarnings("unchecked")
    public List<PlannedAction> toPlannedActions(Map<String, Object> draft) {
        if (draft == null) {
            return Collections.emptyList();
        }
        Object actionsValue = draft.get("actions");
        if (!(actionsValue instanceof List<?> rawActions)) {
            return Collections.emptyList();
        }
        List<PlannedAction> result = new ArrayList<>();
        for (Object item : rawActions) {
            if (!(item instanceof Map<?, ?> rawAction)) {
                continue;
            }
            Map<String, Object> action = (Map<String, Object>) rawAction;
            Object arguments = firstNonNull(action, "arguments", "args", "parameters");
            result.add(PlannedAction.builder()
                    .id(text(firstNonNull(action, "id", "action_id", "actionId")))
                    .toolName(text(firstNonNull(action, "tool_name", "toolName", "tool")))
                    .arguments(arguments instanceof Map<?, ?> map
                            ? new LinkedHashMap<>((Map<String, Object>) map)
                            : new LinkedHashMap<>())
                    .resultVariableName(text(firstNonNull(action, "result_variable_name", "resultVariableName")))
                    .build());
        }
        return result;
    }

    private Object firstNonNull(Map<String, Object> source, String... keys) {
        for (String key : keys) {
            Object value = source.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private String text(Object value) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    private Map<String, Object> parseStrict(String text,
                                            Function<String, Map<String, Object>> strictParser) {
        try {
            return strictParser.apply(text);
        } catch (RuntimeException ex) {
            return null;
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
