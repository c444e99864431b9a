package com.aris.domain.tool.model.valobj;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * 工具调用超时与退避重试策略。
 */
@Data
@Builder
public class ToolCallPolicy {

    private Duration timeout;

    /** 首次调用之外的最大重试次数 */
    private int maxRetries;

    private long initialBackoffMs;

    private long maxBackoffMs;

    private double backoffMultiplier;

    /**
     * 第 retry 次重试 (从 1 开始) 前的等待时间。
     */
    public long backoffMillis(int retry) {
        if (retry <= 0 || initialBackoffMs <= 0) {
            return 0L;
        }
        double multiplier = backoffMultiplier < 1.0 ? 1.0 : backoffMultiplier;
        double delay = initialBackoffMs * Math.pow(multiplier, retry - 1);
        long cap = maxBackoffMs <= 0 ? Long.MAX_VALUE : maxBackoffMs;
        return (long) Math.min(delay, cap);
    }
}
