package com.aris.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 动作状态枚举
 *
 * @author getoffer
 * @since 2025-01-29
 */
public enum ActionStatusEnum {

    /** 待执行 */
    PENDING("pending"),

    /** 启动中 - 正在解析模板变量 */
    STARTING("starting"),

    /** 执行中 - 工具调用已发出 */
    IN_PROGRESS("in_progress"),

    /** 已完成 */
    COMPLETED("completed"),

    /** 失败 */
    FAILED("failed");

    private final String code;

    ActionStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static ActionStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ActionStatusEnum status : ActionStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown action status code: " + code);
    }
}
