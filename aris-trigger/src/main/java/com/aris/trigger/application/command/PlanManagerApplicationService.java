package com.aris.trigger.application.command;

import com.aris.domain.memory.model.valobj.MemorySearchCriteria;
import com.aris.domain.memory.service.MemoryStoreDomainService;
import com.aris.domain.planning.adapter.gateway.IPlanProgressListener;
import com.aris.domain.planning.adapter.repository.IActionRepository;
import com.aris.domain.planning.adapter.repository.IPlanRepository;
import com.aris.domain.planning.model.entity.ActionEntity;
import com.aris.domain.planning.model.entity.PlanEntity;
import com.aris.domain.planning.model.valobj.ActionProgressEvent;
import com.aris.domain.planning.model.valobj.AssembledPlan;
import com.aris.domain.planning.model.valobj.PlanExecutionContext;
import com.aris.domain.planning.model.valobj.PlanExecutionResult;
import com.aris.domain.planning.model.valobj.PlannedAction;
import com.aris.domain.planning.service.PlanAssemblyDomainService;
import com.aris.domain.planning.service.PlanTransitionDomainService;
import com.aris.domain.template.model.valobj.TemplateContext;
import com.aris.domain.template.service.TemplateResolverDomainService;
import com.aris.domain.tool.model.valobj.ToolCallPolicy;
import com.aris.domain.tool.model.valobj.ToolResultEnvelope;
import com.aris.domain.tool.service.ToolCallDomainService;
import com.aris.trigger.config.ExecutionProperties;
import com.aris.types.common.Constants;
import com.aris.types.enums.ActionStatusEnum;
import com.aris.types.enums.PlanStatusEnum;
import com.aris.types.enums.ResponseCode;
import com.aris.types.exception.AppException;
import com.aris.types.exception.PersistenceException;
import com.aris.types.exception.TemplateResolutionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 计划管理用例：创建计划并按顺序执行其动作。
 * <p>
 * 每次状态迁移先落库再推送事件；任一动作失败后停止，后续动作保持 pending。
 * 工具调用、模板解析与记忆写入分别委托给对应领域服务。
 * </p>
 */
@Slf4j
@Service
public class PlanManagerApplicationService {

    private static final String METRIC_PLAN_FINISHED = "aris.plan.finished";
    private static final String METRIC_ACTION_FINISHED = "aris.action.finished";
    private static final String METRIC_TOOL_RETRY = "aris.tool.retry";

    private final IPlanRepository planRepository;
    private final IActionRepository actionRepository;
    private final PlanAssemblyDomainService planAssemblyDomainService;
    private final PlanTransitionDomainService planTransitionDomainService;
    private final TemplateResolverDomainService templateResolverDomainService;
    private final ToolCallDomainService toolCallDomainService;
    private final MemoryStoreDomainService memoryStoreDomainService;
    private final ExecutionProperties executionProperties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public PlanManagerApplicationService(IPlanRepository planRepository,
                                         IActionRepository actionRepository,
                                         PlanAssemblyDomainService planAssemblyDomainService,
                                         PlanTransitionDomainService planTransitionDomainService,
                                         TemplateResolverDomainService templateResolverDomainService,
                                         ToolCallDomainService toolCallDomainService,
                                         MemoryStoreDomainService memoryStoreDomainService,
                                         ExecutionProperties executionProperties,
                                         ObjectMapper objectMapper) {
        this.planRepository = planRepository;
        this.actionRepository = actionRepository;
        this.planAssemblyDomainService = planAssemblyDomainService;
        this.planTransitionDomainService = planTransitionDomainService;
        this.templateResolverDomainService = templateResolverDomainService;
        this.toolCallDomainService = toolCallDomainService;
        this.memoryStoreDomainService = memoryStoreDomainService;
        this.executionProperties = executionProperties;
        this.objectMapper = objectMapper;
        this.meterRegistry = Metrics.globalRegistry;
    }

    /**
     * 组装并在单个事务中持久化计划与全部动作。
     *
     * @throws AppException 参数非法或持久化失败，此时不会执行任何工具调用
     */
    public PlanEntity createPlan(String chatId, String userQuery, List<PlannedAction> plannedActions) {
        AssembledPlan assembled = planAssemblyDomainService.assemble(chatId, userQuery, plannedActions);
        PlanEntity saved = planRepository.saveWithActions(assembled.getPlan(), assembled.getActions());
        log.info("PLAN_CREATED planId={}, chatId={}, actions={}", saved.getId(), chatId, assembled.getActions().size());
        return saved;
    }

    /**
     * 顺序执行计划。仅接受状态为 new 的计划。
     */
    public PlanExecutionResult executePlan(String planId, PlanExecutionContext context) {
        PlanEntity plan = planRepository.findById(planId);
        if (plan == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Plan not found: " + planId);
        }
        if (plan.getStatus() != PlanStatusEnum.NEW) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER,
                    "Plan " + planId + " cannot be executed from status " + plan.getStatus().getCode());
        }
        List<ActionEntity> actions = actionRepository.findByPlanId(planId);
        planTransitionDomainService.transitPlan(plan, PlanStatusEnum.IN_PROGRESS, null);
        if (!planRepository.updateStatus(plan, PlanStatusEnum.NEW)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Plan " + planId + " is already being executed");
        }

        ToolCallPolicy policy = buildPolicy();
        List<ActionEntity> completedActions = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        String failure = null;
        String failedActionId = null;
        for (ActionEntity action : actions) {
            if (context.isCancelled()) {
                failure = StringUtils.defaultIfBlank(context.getCancellationReason(), Constants.CONNECTION_CLOSED_REASON);
                break;
            }
            try {
                boolean succeeded = runAction(plan, action, completedActions, warnings, policy, context);
                if (!succeeded) {
                    failure = planTransitionDomainService.describeFailure(action);
                    failedActionId = action.getId();
                    break;
                }
            } catch (AppException ex) {
                failure = abortOnPersistenceFailure(action, ex, context.getProgressListener());
                failedActionId = action.getId();
                break;
            }
        }

        PlanStatusEnum target = failure == null ? PlanStatusEnum.COMPLETED : PlanStatusEnum.FAILED;
        planTransitionDomainService.transitPlan(plan, target, failure);
        persistFinalStatus(plan, target);
        meterRegistry.counter(METRIC_PLAN_FINISHED, "status", target.getCode()).increment();
        log.info("PLAN_FINISHED planId={}, status={}, completedActions={}, error={}",
                planId, target.getCode(), completedActions.size(), failure);
        return PlanExecutionResult.builder()
                .planId(planId)
                .status(target)
                .error(failure)
                .failedActionId(failedActionId)
                .actions(actions)
                .warnings(warnings)
                .build();
    }

    /**
     * 终态未落库时不向调用方报告终态，库中状态仍以 in_progress 为准。
     */
    private void persistFinalStatus(PlanEntity plan, PlanStatusEnum target) {
        boolean updated;
        try {
            updated = planRepository.updateStatus(plan, PlanStatusEnum.IN_PROGRESS);
        } catch (RuntimeException ex) {
            log.error("Failed to persist final plan status planId={}, status={}, error={}",
                    plan.getId(), target.getCode(), ex.getMessage(), ex);
            throw new PersistenceException("Failed to persist final status " + target.getCode()
                    + " of plan " + plan.getId(), ex);
        }
        if (!updated) {
            log.error("Failed to persist final plan status planId={}, status={}, error=status changed concurrently",
                    plan.getId(), target.getCode());
            throw new AppException(ResponseCode.PERSISTENCE_FAILURE, "Failed to persist final status "
                    + target.getCode() + " of plan " + plan.getId() + ": plan is no longer in_progress");
        }
    }

    private boolean runAction(PlanEntity plan,
                              ActionEntity action,
                              List<ActionEntity> completedActions,
                              List<String> warnings,
                              ToolCallPolicy policy,
                              PlanExecutionContext context) {
        action.markStarting();
        transition(action, context.getProgressListener());

        Map<String, Object> resolvedArguments;
        try {
            resolvedArguments = templateResolverDomainService.resolveArguments(action.getArguments(),
                    buildTemplateContext(plan.getChatId(), completedActions));
        } catch (TemplateResolutionException ex) {
            action.fail(ex.getMessage());
            transition(action, context.getProgressListener());
            meterRegistry.counter(METRIC_ACTION_FINISHED, "tool", action.getToolName(), "status", "failed").increment();
            return false;
        }
        action.markInProgress(resolvedArguments);
        transition(action, context.getProgressListener());

        ToolResultEnvelope envelope = toolCallDomainService.invoke(context.getToolRouter(),
                action.getToolName(), resolvedArguments, policy);
        if (envelope.getAttempts() > 1) {
            String kind = envelope.getError() == null ? "recovered" : envelope.getError().getCode();
            log.info("TOOL_CALL_RETRY actionId={}, tool={}, attempts={}, kind={}",
                    action.getId(), action.getToolName(), envelope.getAttempts(), kind);
            meterRegistry.counter(METRIC_TOOL_RETRY, "tool", action.getToolName(), "kind", kind)
                    .increment(envelope.getAttempts() - 1);
        }
        if (!envelope.isOk()) {
            action.fail(envelope.getErrorMessage());
            transition(action, context.getProgressListener());
            meterRegistry.counter(METRIC_ACTION_FINISHED, "tool", action.getToolName(), "status", "failed").increment();
            return false;
        }

        action.complete(envelope.getValue());
        actionRepository.update(action);
        String memoryWarning = rememberResult(plan.getChatId(), action);
        if (memoryWarning != null) {
            warnings.add(memoryWarning);
        }
        notifyListener(context.getProgressListener(), action);
        completedActions.add(action);
        meterRegistry.counter(METRIC_ACTION_FINISHED, "tool", action.getToolName(), "status", "completed").increment();
        return true;
    }

    private void transition(ActionEntity action, IPlanProgressListener listener) {
        actionRepository.update(action);
        log.info("ACTION_TRANSITION planId={}, actionId={}, orderIndex={}, tool={}, status={}",
                action.getPlanId(), action.getId(), action.getOrderIndex(), action.getToolName(),
                action.getStatus().getCode());
        notifyListener(listener, action);
    }

    private void notifyListener(IPlanProgressListener listener, ActionEntity action) {
        if (listener == null) {
            return;
        }
        try {
            listener.onActionTransition(ActionProgressEvent.of(action));
        } catch (RuntimeException ex) {
            log.warn("Failed to deliver action event actionId={}, error={}", action.getId(), ex.getMessage());
        }
    }

    /**
     * 记忆写入失败不影响动作成功，但会作为告警随结果事件返回，后续计划引用该结果时可据此定位原因。
     *
     * @return 告警信息，写入成功时为 null
     */
    private String rememberResult(String chatId, ActionEntity action) {
        try {
            memoryStoreDomainService.rememberActionResult(chatId, action, executionProperties.isStoreAllResults());
            return null;
        } catch (RuntimeException ex) {
            log.warn("Failed to store action result in memory actionId={}, chatId={}, error={}",
                    action.getId(), chatId, ex.getMessage());
            return "Result of action " + (action.getOrderIndex() + 1) + " (" + action.getToolName()
                    + ") was not stored in memory: " + StringUtils.defaultIfBlank(ex.getMessage(),
                    ex.getClass().getSimpleName());
        }
    }

    /**
     * 状态落库失败时中止计划，尽量把已启动的动作标记为 failed。
     */
    private String abortOnPersistenceFailure(ActionEntity action, AppException ex, IPlanProgressListener listener) {
        log.warn("Failed to persist action transition actionId={}, status={}, error={}",
                action.getId(), action.getStatus() == null ? null : action.getStatus().getCode(), ex.getMessage());
        String reason = "Persistence failure: " + ex.getMessage();
        if (action.getStatus() == ActionStatusEnum.STARTING || action.getStatus() == ActionStatusEnum.IN_PROGRESS) {
            action.fail(reason);
            try {
                actionRepository.update(action);
                notifyListener(listener, action);
            } catch (AppException retryEx) {
                log.warn("Failed to mark action failed actionId={}, error={}", action.getId(), retryEx.getMessage());
            }
        }
        return reason;
    }

    private TemplateContext buildTemplateContext(String chatId, List<ActionEntity> completedActions) {
        return TemplateContext.builder()
                .completedActions(Collections.unmodifiableList(new ArrayList<>(completedActions)))
                .memoryGet(key -> memoryStoreDomainService.get(chatId, key))
                .memorySearch((MemorySearchCriteria criteria) -> memoryStoreDomainService.search(chatId, criteria))
                .valueSerializer(this::serialize)
                .maxDepth(executionProperties.getTemplateMaxDepth())
                .build();
    }

    private String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return String.valueOf(value);
        }
    }

    private ToolCallPolicy buildPolicy() {
        return ToolCallPolicy.builder()
                .timeout(Duration.ofMillis(executionProperties.getToolTimeoutMs()))
                .maxRetries(executionProperties.getMaxRetries())
                .initialBackoffMs(executionProperties.getInitialBackoffMs())
                .maxBackoffMs(executionProperties.getMaxBackoffMs())
                .backoffMultiplier(executionProperties.getBackoffMultiplier())
                .build();
    }
}
