package com.aris.infrastructure.util;

import com.aris.types.enums.ResponseCode;
import com.aris.types.exception.AppException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSONB 列与工具文本结果的编解码。
 * <p>
 * 空串按 null 处理；标签列缺省为空列表。
 * </p>
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> OBJECT_REF = new TypeReference<Map<String, Object>>() {};
    private static final TypeReference<List<String>> TAGS_REF = new TypeReference<List<String>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 动作参数、解析后参数与结果列，均为 JSON 对象。
     */
    public Map<String, Object> readObject(String json) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, OBJECT_REF);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Malformed JSON object: " + abbreviate(json), ex);
        }
    }

    /**
     * 记忆值可以是任意 JSON：对象、数组或标量。
     */
    public Object readAny(String json) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Malformed JSON value: " + abbreviate(json), ex);
        }
    }

    public List<String> readTags(String json) {
        if (StringUtils.isBlank(json)) {
            return new ArrayList<>();
        }
        try {
            List<String> tags = objectMapper.readValue(json, TAGS_REF);
            return tags == null ? new ArrayList<>() : new ArrayList<>(tags);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Malformed tag array: " + abbreviate(json), ex);
        }
    }

    public String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(),
                    "Failed to serialize " + value.getClass().getSimpleName(), ex);
        }
    }

    private String abbreviate(String json) {
        return StringUtils.abbreviate(json, 120);
    }
}
