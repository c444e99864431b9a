package com.aris.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义系统中所有 API 响应与 WebSocket 错误事件的响应码和对应描述信息。
 * </p>
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 持久化失败，计划不会被执行 */
    PERSISTENCE_FAILURE("0003", "持久化失败"),

    /** 模板变量无法解析 */
    TEMPLATE_RESOLUTION_FAILURE("0004", "模板变量解析失败"),

    /** 工具服务不可达 */
    TOOL_UNREACHABLE("0005", "工具服务不可达"),

    /** 工具调用超时 */
    TOOL_TIMEOUT("0006", "工具调用超时"),

    /** 工具服务需要认证 */
    TOOL_AUTH_REQUIRED("0007", "工具服务认证失败"),

    /** 工具返回业务错误 */
    TOOL_ERROR("0008", "工具执行失败"),

    /** 客户端连接已关闭 */
    CONNECTION_CLOSED("0009", "连接已关闭"),

    /** 资源不存在 */
    NOT_FOUND("0010", "资源不存在");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
