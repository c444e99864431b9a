package com.aris.domain.tool.service;

import com.aris.domain.tool.adapter.gateway.IToolRouter;
import com.aris.domain.tool.model.valobj.ToolCallPolicy;
import com.aris.domain.tool.model.valobj.ToolResultEnvelope;
import com.aris.types.enums.ToolErrorKindEnum;
import com.aris.types.exception.ToolInvocationException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 工具调用领域服务：在路由之上施加超时与有限次指数退避重试，并把结果统一为信封。
 */
@Service
public class ToolCallDomainService {

    public ToolResultEnvelope invoke(IToolRouter router,
                                     String toolName,
                                     Map<String, Object> arguments,
                                     ToolCallPolicy policy) {
        int maxAttempts = 1 + Math.max(policy.getMaxRetries(), 0);
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return ToolResultEnvelope.success(router.invoke(toolName, arguments, policy.getTimeout()), attempt);
            } catch (ToolInvocationException ex) {
                ToolErrorKindEnum kind = ex.getKind();
                if (!kind.isRetryable() || attempt >= maxAttempts) {
                    return ToolResultEnvelope.failure(kind, describe(kind, ex), attempt);
                }
            } catch (RuntimeException ex) {
                return ToolResultEnvelope.failure(ToolErrorKindEnum.TOOL_ERROR,
                        StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName()), attempt);
            }
            try {
                sleep(policy.backoffMillis(attempt));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return ToolResultEnvelope.failure(ToolErrorKindEnum.UNREACHABLE,
                        "Interrupted while waiting to retry " + toolName, attempt);
            }
        }
    }

    protected void sleep(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    private String describe(ToolErrorKindEnum kind, ToolInvocationException ex) {
        return kind.getCode() + ": " + StringUtils.defaultIfBlank(ex.getMessage(), "no detail");
    }
}
