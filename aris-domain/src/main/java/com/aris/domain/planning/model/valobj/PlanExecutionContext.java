package com.aris.domain.planning.model.valobj;

import com.aris.domain.planning.adapter.gateway.IPlanProgressListener;
import com.aris.domain.tool.adapter.gateway.IToolRouter;
import lombok.Builder;
import lombok.Data;

import java.util.function.BooleanSupplier;

/**
 * 单次计划执行的会话级依赖：工具路由、进度监听与取消信号。
 */
@Data
@Builder
public class PlanExecutionContext {

    private IToolRouter toolRouter;

    private IPlanProgressListener progressListener;

    /** 返回 true 时不再启动后续动作 */
    private BooleanSupplier cancellation;

    /** 取消时写入计划的失败原因 */
    private String cancellationReason;

    public boolean isCancelled() {
        return cancellation != null && cancellation.getAsBoolean();
    }
}
