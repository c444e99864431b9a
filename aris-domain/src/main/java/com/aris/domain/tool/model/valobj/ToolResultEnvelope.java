package com.aris.domain.tool.model.valobj;

import com.aris.types.enums.ToolErrorKindEnum;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 工具结果信封：{ok, value, error}。
 */
@Data
@Builder
public class ToolResultEnvelope {

    private boolean ok;

    private Map<String, Object> value;

    private ToolErrorKindEnum error;

    private String errorMessage;

    /** 实际调用次数 */
    private int attempts;

    public static ToolResultEnvelope success(Map<String, Object> value, int attempts) {
        return ToolResultEnvelope.builder().ok(true).value(value).attempts(attempts).build();
    }

    public static ToolResultEnvelope failure(ToolErrorKindEnum error, String errorMessage, int attempts) {
        return ToolResultEnvelope.builder()
                .ok(false)
                .error(error)
                .errorMessage(errorMessage)
                .attempts(attempts)
                .build();
    }
}
