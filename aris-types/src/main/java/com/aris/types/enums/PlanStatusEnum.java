package com.aris.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 执行计划状态枚举。
 * <p>
 * 状态单调推进：new → in_progress → {completed | failed}，不可回退。
 * </p>
 *
 * @author getoffer
 * @since 2025-01-29
 */
public enum PlanStatusEnum {

    /**
     * 新建 - 计划与全部动作已持久化，尚未执行
     */
    NEW("new"),

    /**
     * 执行中
     */
    IN_PROGRESS("in_progress"),

    /**
     * 已完成 - 所有动作成功执行
     */
    COMPLETED("completed"),

    /**
     * 失败 - 某个动作失败或连接中断
     */
    FAILED("failed");

    private final String code;

    PlanStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static PlanStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (PlanStatusEnum status : PlanStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown plan status code: " + code);
    }
}
