package com.aris.domain.template.service;

import com.aris.domain.memory.model.entity.MemoryEntryEntity;
import com.aris.domain.memory.model.valobj.MemorySearchCriteria;
import com.aris.domain.planning.model.entity.ActionEntity;
import com.aris.domain.template.model.valobj.TemplateContext;
import com.aris.types.exception.TemplateResolutionException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 模板变量解析领域服务。
 * <p>
 * 对参数树 (Map / List / String) 做显式递归下降，替换其中的 {@code {{identifier.path}}}：
 * 字符串恰好是单个占位符时替换为被引用值本身 (保留类型)，否则按字符串插值。
 * 替换进来的值不会再次展开；嵌套深度超过上限时失败。
 * </p>
 *
 * @author getoffer
 * @since 2025-02-03
 */
@Service
public class TemplateResolverDomainService {

    public static final String STRATEGY_ACTION_ID = "action_id";
    public static final String STRATEGY_ACTION_ALIAS = "action_alias";
    public static final String STRATEGY_MEMORY_KEY = "memory_key";
    public static final String STRATEGY_MEMORY_TAG = "memory_tag";
    public static final String STRATEGY_MEMORY_TOOL = "memory_tool";

    private static final Pattern PLACEHOLDER = Pattern.compile(
            "\\{\\{\\s*([A-Za-z0-9_\\-]+)((?:\\.[A-Za-z0-9_\\-]+|\\[\\d+])*)\\s*}}");
    private static final Pattern PATH_SEGMENT = Pattern.compile("\\.([A-Za-z0-9_\\-]+)|\\[(\\d+)]");
    private static final Pattern ORDINAL_ALIAS = Pattern.compile("^(?:action|step)_?(\\d+)$");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");

    private static final Set<String> PREVIOUS_ALIASES = Set.of("previous", "prev", "last",
            "previous_action", "last_action", "previous_result", "last_result");
    private static final List<String> ALIAS_SUFFIXES = List.of("_result", "_action", "_output", "_response", "_id");
    private static final Set<String> FILE_HINTS = Set.of("file", "files", "attachment", "attachments",
            "document", "doc", "report", "url", "link");
    private static final Set<String> EMAIL_HINTS = Set.of("email", "mail");
    private static final Set<String> GENERIC_TOKENS = Set.of("action", "result", "output", "response", "step",
            "previous", "prev", "last", "the", "from", "value", "current");
    private static final int MEMORY_CANDIDATE_LIMIT = 10;
    private static final int DEEP_FIND_MAX_DEPTH = 8;

    /**
     * 解析任意 JSON 值。
     *
     * @throws TemplateResolutionException 存在无法解析的占位符，或嵌套超过最大深度
     */
    public Object resolve(Object value, TemplateContext context) {
        return walk(value, context, 0);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> resolveArguments(Map<String, Object> arguments, TemplateContext context) {
        if (arguments == null) {
            return new LinkedHashMap<>();
        }
        return (Map<String, Object>) walk(arguments, context, 0);
    }

    /**
     * 是否包含占位符。
     */
    public boolean containsPlaceholder(Object value) {
        if (value instanceof String text) {
            return PLACEHOLDER.matcher(text).find();
        }
        if (value instanceof Map<?, ?> map) {
            return map.values().stream().anyMatch(this::containsPlaceholder);
        }
        if (value instanceof List<?> list) {
            return list.stream().anyMatch(this::containsPlaceholder);
        }
        return false;
    }

    private Object walk(Object node, TemplateContext context, int depth) {
        if (depth > context.getMaxDepth()) {
            throw TemplateResolutionException.depthExceeded(context.getMaxDepth());
        }
        if (node instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                resolved.put(String.valueOf(entry.getKey()), walk(entry.getValue(), context, depth + 1));
            }
            return resolved;
        }
        if (node instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            for (Object item : list) {
                resolved.add(walk(item, context, depth + 1));
            }
            return resolved;
        }
        if (node instanceof String text) {
            return resolveString(text, context);
        }
        return node;
    }

    private Object resolveString(String text, TemplateContext context) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        if (matcher.start() == 0 && matcher.end() == text.length()) {
            return lookup(matcher.group(0), matcher.group(1), parsePath(matcher.group(2)), context);
        }
        matcher.reset();
        StringBuilder buffer = new StringBuilder();
        while (matcher.find()) {
            Object value = lookup(matcher.group(0), matcher.group(1), parsePath(matcher.group(2)), context);
            matcher.appendReplacement(buffer, Matcher.quoteReplacement(stringify(value, context)));
        }
        matcher.appendTail(buffer);
        return buffer.toString();
    }

    private Object lookup(String placeholder, String identifier, List<PathSegment> path, TemplateContext context) {
        List<String> attempted = new ArrayList<>();
        List<ActionEntity> completed = context.getCompletedActions() == null
                ? Collections.emptyList()
                : context.getCompletedActions();

        attempted.add(STRATEGY_ACTION_ID);
        for (ActionEntity action : completed) {
            if (identifier.equals(action.getId())) {
                Optional<Object> value = extract(action.getResult(), path);
                if (value.isPresent()) {
                    return value.get();
                }
            }
        }

        attempted.add(STRATEGY_ACTION_ALIAS);
        ActionEntity aliased = findAliasedAction(identifier, completed);
        if (aliased != null) {
            Optional<Object> value = extract(aliased.getResult(), path);
            if (value.isPresent()) {
                return value.get();
            }
        }

        if (context.getMemoryGet() != null) {
            attempted.add(STRATEGY_MEMORY_KEY);
            MemoryEntryEntity entry = context.getMemoryGet().apply(identifier);
            if (entry != null) {
                Optional<Object> value = extract(entry.getValue(), path);
                if (value.isPresent()) {
                    return value.get();
                }
            }
        }

        if (context.getMemorySearch() != null) {
            attempted.add(STRATEGY_MEMORY_TAG);
            for (String tag : inferTags(identifier)) {
                Optional<Object> value = firstExtractable(
                        context.getMemorySearch().apply(limited(MemorySearchCriteria.byTag(tag))), path);
                if (value.isPresent()) {
                    return value.get();
                }
            }

            attempted.add(STRATEGY_MEMORY_TOOL);
            for (String tool : toolCandidates(identifier)) {
                Optional<Object> value = firstExtractable(
                        context.getMemorySearch().apply(limited(MemorySearchCriteria.byTool(tool))), path);
                if (value.isPresent()) {
                    return value.get();
                }
            }
        }

        throw TemplateResolutionException.unresolved(placeholder, identifier, attempted);
    }

    /**
     * 规划器常以符号 ID 代替真实 ID 引用本计划中更早的动作。
     */
    private ActionEntity findAliasedAction(String identifier, List<ActionEntity> completed) {
        if (completed.isEmpty()) {
            return null;
        }
        for (ActionEntity action : completed) {
            if (identifier.equals(action.getAlias()) || identifier.equals(action.getResultVariableName())) {
                return action;
            }
        }
        String normalized = identifier.toLowerCase(Locale.ROOT);
        if (PREVIOUS_ALIASES.contains(normalized)) {
            return completed.get(completed.size() - 1);
        }
        Matcher ordinal = ORDINAL_ALIAS.matcher(normalized);
        if (ordinal.matches()) {
            int orderIndex = Integer.parseInt(ordinal.group(1)) - 1;
            for (ActionEntity action : completed) {
                if (action.getOrderIndex() != null && action.getOrderIndex() == orderIndex) {
                    return action;
                }
            }
        }
        for (String tool : toolCandidates(identifier)) {
            for (int i = completed.size() - 1; i >= 0; i--) {
                if (tool.equalsIgnoreCase(completed.get(i).getToolName())) {
                    return completed.get(i);
                }
            }
        }
        return null;
    }

    private Set<String> inferTags(String identifier) {
        List<String> tokens = tokenize(identifier);
        Set<String> tags = new LinkedHashSet<>();
        if (tokens.contains("pdf")) {
            tags.add("pdf");
            tags.add("file");
        }
        if (tokens.stream().anyMatch(FILE_HINTS::contains)) {
            tags.add("file");
            tags.add("pdf");
        }
        if (tokens.stream().anyMatch(EMAIL_HINTS::contains)) {
            tags.add("email");
        }
        for (String token : tokens) {
            if (token.length() >= 3 && !GENERIC_TOKENS.contains(token) && !StringUtils.isNumeric(token)) {
                tags.add(token);
            }
        }
        return tags;
    }

    private Set<String> toolCandidates(String identifier) {
        Set<String> candidates = new LinkedHashSet<>();
        String normalized = identifier.toLowerCase(Locale.ROOT);
        candidates.add(normalized);
        for (String suffix : ALIAS_SUFFIXES) {
            if (normalized.endsWith(suffix) && normalized.length() > suffix.length()) {
                candidates.add(normalized.substring(0, normalized.length() - suffix.length()));
            }
        }
        return candidates;
    }

    private List<String> tokenize(String identifier) {
        String spaced = CAMEL_BOUNDARY.matcher(identifier).replaceAll("_");
        List<String> tokens = new ArrayList<>();
        for (String token : spaced.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private MemorySearchCriteria limited(MemorySearchCriteria criteria) {
        criteria.setLimit(MEMORY_CANDIDATE_LIMIT);
        return criteria;
    }

    private Optional<Object> firstExtractable(List<MemoryEntryEntity> entries, List<PathSegment> path) {
        if (entries == null) {
            return Optional.empty();
        }
        for (MemoryEntryEntity entry : entries) {
            Optional<Object> value = extract(entry.getValue(), path);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * 按路径取值。以 result 开头的路径缺失时去掉该前缀重试；单段路径在顶层缺失时：
     * result 返回整个结果，其他字段做深度优先查找。
     */
    private Optional<Object> extract(Object root, List<PathSegment> path) {
        if (root == null) {
            return Optional.empty();
        }
        Object current = root;
        boolean found = true;
        for (PathSegment segment : path) {
            current = step(current, segment);
            if (current == null) {
                found = false;
                break;
            }
        }
        if (found) {
            return Optional.of(current);
        }
        if (path.size() > 1 && "result".equals(path.get(0).name)) {
            return extract(root, path.subList(1, path.size()));
        }
        if (path.size() == 1 && path.get(0).name != null) {
            String name = path.get(0).name;
            if ("result".equals(name)) {
                return Optional.of(root);
            }
            return Optional.ofNullable(deepFind(root, name, 0));
        }
        return Optional.empty();
    }

    private Object step(Object current, PathSegment segment) {
        if (segment.index != null) {
            return current instanceof List<?> list && segment.index < list.size() ? list.get(segment.index) : null;
        }
        if (current instanceof Map<?, ?> map) {
            return map.get(segment.name);
        }
        if (current instanceof List<?> list && StringUtils.isNumeric(segment.name)) {
            int index = Integer.parseInt(segment.name);
            return index < list.size() ? list.get(index) : null;
        }
        return null;
    }

    private Object deepFind(Object node, String name, int depth) {
        if (depth > DEEP_FIND_MAX_DEPTH) {
            return null;
        }
        if (node instanceof Map<?, ?> map) {
            Object direct = map.get(name);
            if (direct != null) {
                return direct;
            }
            for (Object child : map.values()) {
                Object found = deepFind(child, name, depth + 1);
                if (found != null) {
                    return found;
                }
            }
        } else if (node instanceof List<?> list) {
            for (Object child : list) {
                Object found = deepFind(child, name, depth + 1);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private List<PathSegment> parsePath(String rawPath) {
        if (StringUtils.isEmpty(rawPath)) {
            return Collections.emptyList();
        }
        List<PathSegment> segments = new ArrayList<>();
        Matcher matcher = PATH_SEGMENT.matcher(rawPath);
        while (matcher.find()) {
            segments.add(matcher.group(1) != null
                    ? new PathSegment(matcher.group(1), null)
                    : new PathSegment(null, Integer.parseInt(matcher.group(2))));
        }
        return segments;
    }

    private String stringify(Object value, TemplateContext context) {
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        if (context.getValueSerializer() != null) {
            try {
                String serialized = context.getValueSerializer().apply(value);
                if (serialized != null) {
                    return serialized;
                }
            } catch (RuntimeException ex) {
                return String.valueOf(value);
            }
        }
        return String.valueOf(value);
    }

    private static final class PathSegment {

        private final String name;
        private final Integer index;

        private PathSegment(String name, Integer index) {
            this.name = name;
            this.index = index;
        }
    }
}
