package com.aris.types.common;

/**
 * 全局常量。
 *
 * @author getoffer
 * @since 2025-01-29
 */
public class Constants {

    /** 连接关闭导致计划中止时记录的失败原因 */
    public final static String CONNECTION_CLOSED_REASON = "connection_closed";

    /** 未指定 result_variable_name 时的默认记忆键前缀 */
    public final static String TOOL_RESULT_KEY_PREFIX = "tool_result_";

    public final static String TAG_TOOL_RESULT = "tool_result";

    public final static String TAG_AUTO_STORED = "auto_stored";

    public final static String TAG_FILE = "file";

    public final static String TAG_PDF = "pdf";

    public final static String TAG_EMAIL = "email";

    public final static String TAG_DATA = "data";

    public final static String EVENT_TYPE_STATUS = "status";

    public final static String EVENT_TYPE_RESULT = "result";

    public final static String EVENT_TYPE_ERROR = "error";

}
