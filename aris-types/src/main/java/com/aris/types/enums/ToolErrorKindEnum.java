package com.aris.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工具调用错误类型。
 *
 * @author getoffer
 * @since 2025-02-03
 */
public enum ToolErrorKindEnum {

    UNREACHABLE("unreachable", ResponseCode.TOOL_UNREACHABLE, true),
    TIMEOUT("timeout", ResponseCode.TOOL_TIMEOUT, true),
    AUTH_REQUIRED("auth_required", ResponseCode.TOOL_AUTH_REQUIRED, false),
    TOOL_ERROR("tool_error", ResponseCode.TOOL_ERROR, false);

    private final String code;
    private final ResponseCode responseCode;
    /** 是否允许退避重试 */
    private final boolean retryable;

    ToolErrorKindEnum(String code, ResponseCode responseCode, boolean retryable) {
        this.code = code;
        this.responseCode = responseCode;
        this.retryable = retryable;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public ResponseCode getResponseCode() {
        return responseCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static ToolErrorKindEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ToolErrorKindEnum kind : ToolErrorKindEnum.values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown tool error kind: " + code);
    }
}
