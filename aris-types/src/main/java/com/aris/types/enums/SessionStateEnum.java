package com.aris.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 会话状态：IDLE → INITIALIZING → ACTIVE → IDLE ... → CLOSED
 */
public enum SessionStateEnum {

    IDLE("idle"),
    INITIALIZING("initializing"),
    ACTIVE("active"),
    CLOSED("closed");

    private final String code;

    SessionStateEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
