package com.aris.trigger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 计划执行配置，前缀 aris.execution。
 *
 * @author getoffer
 * @since 2025-02-05
 */
@Data
@ConfigurationProperties(prefix = "aris.execution", ignoreInvalidFields = true)
public class ExecutionProperties {

    /** 单次工具调用超时 (毫秒)，默认30000 */
    private long toolTimeoutMs = 30_000L;

    /** Unreachable / Timeout 的额外重试次数，默认2 */
    private int maxRetries = 2;

    /** 首次重试前等待 (毫秒)，默认500 */
    private long initialBackoffMs = 500L;

    /** 单次等待上限 (毫秒)，默认5000 */
    private long maxBackoffMs = 5_000L;

    private double backoffMultiplier = 2.0D;

    /** 未命名的成功结果是否以 tool_result_{actionId} 写入记忆，默认开启 */
    private boolean storeAllResults = true;

    /** 模板嵌套解析深度上限 */
    private int templateMaxDepth = 32;

    /** 会话内保留的历史条数 */
    private int historyLimit = 20;
}
