package com.aris.domain.memory.service;

import com.aris.types.common.Constants;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 记忆标签领域服务。
 * <p>
 * 标签只由 (工具名, 参数, 结果) 决定，相同输入总是得到相同且有序的标签列表：
 * </p>
 * <ul>
 *   <li>所有条目：tool_result + 工具名</li>
 *   <li>产出文件的工具：file / pdf，以及文件名、标题中的关键词</li>
 *   <li>邮件工具：email</li>
 *   <li>数据查询工具 (get_*)：data、实体名词，以及 id/name/type/group 类参数的取值</li>
 * </ul>
 *
 * @author getoffer
 * @since 2025-02-03
 */
@Service
public class MemoryTagDomainService {

    private static final int MAX_KEYWORDS = 8;
    private static final int MAX_ARGUMENT_TAG_LENGTH = 64;

    private static final List<String> FILE_TOOL_HINTS = List.of("pdf", "file", "document", "report");
    private static final List<String> FILE_URL_FIELDS = List.of("file_url", "download_url", "url");
    private static final List<String> FILE_NAME_FIELDS = List.of("filename", "file_name", "title", "name");
    private static final List<String> NESTED_FIELDS = List.of("data", "result", "file");
    private static final List<String> ARGUMENT_KEY_SUFFIXES = List.of("id", "name", "type", "group");
    private static final Set<String> KEYWORD_STOPWORDS = Set.of(
            "pdf", "doc", "docx", "xls", "xlsx", "csv", "txt", "png", "jpg", "jpeg", "json", "html",
            "the", "and", "for", "with", "from", "file", "http", "https", "www");

    public List<String> generateTags(String toolName,
                                     Map<String, Object> arguments,
                                     Map<String, Object> result,
                                     boolean autoStored) {
        Set<String> tags = new LinkedHashSet<>();
        tags.add(Constants.TAG_TOOL_RESULT);
        String tool = StringUtils.lowerCase(StringUtils.trimToEmpty(toolName), Locale.ROOT);
        if (!tool.isEmpty()) {
            tags.add(tool);
        }
        if (autoStored) {
            tags.add(Constants.TAG_AUTO_STORED);
        }

        if (isFileProducer(tool, result)) {
            tags.add(Constants.TAG_FILE);
            if (isPdf(tool, result)) {
                tags.add(Constants.TAG_PDF);
            }
            Set<String> keywords = new LinkedHashSet<>();
            for (String field : FILE_NAME_FIELDS) {
                keywords.addAll(extractKeywords(findText(result, field)));
                keywords.addAll(extractKeywords(findText(arguments, field)));
            }
            keywords.stream().limit(MAX_KEYWORDS).forEach(tags::add);
        }

        if (tool.contains("email") || tool.contains("mail")) {
            tags.add(Constants.TAG_EMAIL);
        }

        if (tool.startsWith("get_")) {
            tags.add(Constants.TAG_DATA);
            for (String token : tool.substring(4).split("_")) {
                if (token.length() >= 3) {
                    tags.add(token);
                }
            }
            tags.addAll(argumentTags(arguments));
        }
        return new ArrayList<>(tags);
    }

    private boolean isFileProducer(String tool, Map<String, Object> result) {
        for (String hint : FILE_TOOL_HINTS) {
            if (tool.contains(hint)) {
                return true;
            }
        }
        for (String field : FILE_URL_FIELDS) {
            if (!"url".equals(field) && findText(result, field) != null) {
                return true;
            }
        }
        return findText(result, "filename") != null || findText(result, "file_name") != null;
    }

    private boolean isPdf(String tool, Map<String, Object> result) {
        if (tool.contains("pdf")) {
            return true;
        }
        for (String field : List.of("file_url", "download_url", "filename", "file_name")) {
            String text = findText(result, field);
            if (text != null && text.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
                return true;
            }
        }
        return false;
    }

    private List<String> extractKeywords(String text) {
        List<String> keywords = new ArrayList<>();
        if (StringUtils.isBlank(text)) {
            return keywords;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (token.length() < 3 || KEYWORD_STOPWORDS.contains(token) || StringUtils.isNumeric(token)) {
                continue;
            }
            keywords.add(token);
        }
        return keywords;
    }

    private List<String> argumentTags(Map<String, Object> arguments) {
        List<String> result = new ArrayList<>();
        if (arguments == null) {
            return result;
        }
        for (Map.Entry<String, Object> entry : arguments.entrySet()) {
            String key = StringUtils.lowerCase(entry.getKey(), Locale.ROOT);
            Object value = entry.getValue();
            if (key == null || !(value instanceof String || value instanceof Number)) {
                continue;
            }
            if (ARGUMENT_KEY_SUFFIXES.stream().noneMatch(key::endsWith)) {
                continue;
            }
            String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
            if (!text.isEmpty() && text.length() <= MAX_ARGUMENT_TAG_LENGTH && !text.contains("{{")) {
                result.add(text);
            }
        }
        return result;
    }

    /**
     * 取顶层字段，缺失时再看一层嵌套对象 (data / result / file)。
     */
    @SuppressWarnings("unchecked")
    private String findText(Map<String, Object> source, String field) {
        if (source == null) {
            return null;
        }
        Object value = source.get(field);
        if (value instanceof String text && StringUtils.isNotBlank(text)) {
            return text;
        }
        for (String nested : NESTED_FIELDS) {
            Object child = source.get(nested);
            if (child instanceof Map<?, ?> map) {
                Object nestedValue = ((Map<String, Object>) map).get(field);
                if (nestedValue instanceof String text && StringUtils.isNotBlank(text)) {
                    return text;
                }
            }
        }
        return null;
    }
}
