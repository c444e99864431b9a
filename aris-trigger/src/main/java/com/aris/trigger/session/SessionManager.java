package com.aris.trigger.session;

import com.aris.api.dto.ChatInboundMessageDTO;
import com.aris.api.dto.ErrorEventDTO;
import com.aris.domain.chat.adapter.repository.IChatRepository;
import com.aris.domain.planning.adapter.gateway.IPlannerGateway;
import com.aris.domain.planning.model.entity.PlanEntity;
import com.aris.domain.planning.model.valobj.PlanExecutionContext;
import com.aris.domain.planning.model.valobj.PlanExecutionResult;
import com.aris.domain.planning.model.valobj.PlannedAction;
import com.aris.domain.session.model.entity.SessionContextEntity;
import com.aris.domain.session.model.valobj.ChatHistoryMessage;
import com.aris.domain.tool.adapter.gateway.IToolRouter;
import com.aris.domain.tool.adapter.gateway.IToolRouterFactory;
import com.aris.trigger.application.command.PlanManagerApplicationService;
import com.aris.trigger.application.common.PlanViewAssembler;
import com.aris.trigger.config.ExecutionProperties;
import com.aris.types.common.Constants;
import com.aris.types.enums.PlanStatusEnum;
import com.aris.types.enums.ResponseCode;
import com.aris.types.exception.AppException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 会话管理：连接生命周期、消息处理回合以及事件推送。
 * <p>
 * 每条入站消息在计划执行线程池中处理：规划 → 创建计划 → 建立工具连接 → 执行 → 推送终态。
 * 各会话的工具路由、历史与出站队列互不共享。
 * </p>
 */
@Slf4j
@Service
public class SessionManager {

    private final IToolRouterFactory toolRouterFactory;
    private final IPlannerGateway plannerGateway;
    private final IChatRepository chatRepository;
    private final PlanManagerApplicationService planManagerApplicationService;
    private final PlanViewAssembler planViewAssembler;
    private final ExecutionProperties executionProperties;
    private final ObjectMapper objectMapper;
    private final ThreadPoolExecutor planExecutionWorker;

    private final ConcurrentMap<String, OrchestrationSession> sessions = new ConcurrentHashMap<>();

    public SessionManager(IToolRouterFactory toolRouterFactory,
                          IPlannerGateway plannerGateway,
                          IChatRepository chatRepository,
                          PlanManagerApplicationService planManagerApplicationService,
                          PlanViewAssembler planViewAssembler,
                          ExecutionProperties executionProperties,
                          ObjectMapper objectMapper,
                          @Qualifier("planExecutionWorker") ThreadPoolExecutor planExecutionWorker) {
        this.toolRouterFactory = toolRouterFactory;
        this.plannerGateway = plannerGateway;
        this.chatRepository = chatRepository;
        this.planManagerApplicationService = planManagerApplicationService;
        this.planViewAssembler = planViewAssembler;
        this.executionProperties = executionProperties;
        this.objectMapper = objectMapper;
        this.planExecutionWorker = planExecutionWorker;
    }

    public OrchestrationSession open(String sessionId, String chatId, ISessionOutbound outbound) {
        if (StringUtils.isBlank(sessionId) || StringUtils.isBlank(chatId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "sessionId与chatId不能为空");
        }
        chatRepository.ensureExists(chatId);
        IToolRouter router = toolRouterFactory.create(sessionId, chatId);
        SessionContextEntity context = new SessionContextEntity(sessionId, chatId, executionProperties.getHistoryLimit());
        OrchestrationSession session = new OrchestrationSession(context, router, outbound);
        OrchestrationSession previous = sessions.put(sessionId, session);
        if (previous != null) {
            previous.close();
        }
        log.info("SESSION_OPENED sessionId={}, chatId={}", sessionId, chatId);
        return session;
    }

    /**
     * 异步处理一条入站消息，结果通过会话出站通道推送。
     */
    public void handleMessage(String sessionId, String payload) {
        OrchestrationSession session = sessions.get(sessionId);
        if (session == null || session.isClosed()) {
            log.warn("Failed to handle message for unknown session sessionId={}", sessionId);
            return;
        }
        String message;
        try {
            message = parseMessage(payload);
        } catch (AppException ex) {
            session.emit(new ErrorEventDTO(ex.getCode(), ex.getInfo()));
            return;
        }
        try {
            planExecutionWorker.execute(() -> processTurn(session, message));
        } catch (RejectedExecutionException ex) {
            log.warn("Failed to schedule turn sessionId={}, error={}", sessionId, ex.getMessage());
            session.emit(new ErrorEventDTO(ResponseCode.UN_ERROR.getCode(), "Server is busy, please retry later"));
        }
    }

    /**
     * 处理一个回合。同一会话的回合串行执行。
     */
    public void processTurn(OrchestrationSession session, String message) {
        session.lockTurn();
        try {
            if (session.isClosed()) {
                return;
            }
            runTurn(session, message);
        } finally {
            session.unlockTurn();
            if (session.isClosed()) {
                session.getToolRouter().close();
            }
        }
    }

    public void close(String sessionId) {
        OrchestrationSession session = sessions.remove(sessionId);
        if (session == null) {
            return;
        }
        boolean released = session.close();
        log.info("SESSION_CLOSED sessionId={}, chatId={}, routerReleased={}",
                sessionId, session.getChatId(), released);
    }

    public OrchestrationSession getSession(String sessionId) {
        return sessions.get(sessionId);
    }

    private void runTurn(OrchestrationSession session, String message) {
        SessionContextEntity context = session.getContext();
        IToolRouter router = session.getToolRouter();
        context.beginTurn(router.isConnected());
        try {
            List<ChatHistoryMessage> history = context.historySnapshot();
            List<PlannedAction> plannedActions = plannerGateway.plan(message, history);
            if (plannedActions == null || plannedActions.isEmpty()) {
                session.emit(new ErrorEventDTO(ResponseCode.ILLEGAL_PARAMETER.getCode(),
                        "Planner produced no actions for the request"));
                context.appendHistory(ChatHistoryMessage.ROLE_USER, message);
                return;
            }
            if (session.isClosed()) {
                // 规划期间连接已断开，不再创建计划
                log.info("TURN_ABANDONED sessionId={}, chatId={}, stage=planning, plannedActions={}",
                        session.getSessionId(), session.getChatId(), plannedActions.size());
                return;
            }
            PlanEntity plan = planManagerApplicationService.createPlan(session.getChatId(), message, plannedActions);

            if (!session.isClosed()) {
                router.prepare(toolNames(plannedActions));
            }
            if (!context.markActive()) {
                // 计划已落库：交给执行流程按取消处理，以 connection_closed 结束
                log.info("TURN_CANCELLED sessionId={}, planId={}, stage=connecting", session.getSessionId(), plan.getId());
            }

            PlanExecutionContext executionContext = PlanExecutionContext.builder()
                    .toolRouter(router)
                    .progressListener(event -> session.emit(planViewAssembler.toStatusEvent(event)))
                    .cancellation(session::isClosed)
                    .cancellationReason(Constants.CONNECTION_CLOSED_REASON)
                    .build();
            PlanExecutionResult result = planManagerApplicationService.executePlan(plan.getId(), executionContext);
            session.emit(planViewAssembler.toResultEvent(result));

            context.appendHistory(ChatHistoryMessage.ROLE_USER, message);
            context.appendHistory(ChatHistoryMessage.ROLE_ASSISTANT, summarize(result));
        } catch (AppException ex) {
            log.warn("Failed to process turn sessionId={}, code={}, error={}",
                    session.getSessionId(), ex.getCode(), ex.getInfo());
            session.emit(new ErrorEventDTO(ex.getCode(), ex.getInfo()));
        } catch (RuntimeException ex) {
            log.error("Failed to process turn sessionId={}, error={}", session.getSessionId(), ex.getMessage(), ex);
            session.emit(new ErrorEventDTO(ResponseCode.UN_ERROR.getCode(),
                    StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.UN_ERROR.getInfo())));
        } finally {
            context.endTurn();
        }
    }

    private String parseMessage(String payload) {
        if (StringUtils.isBlank(payload)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "消息不能为空");
        }
        ChatInboundMessageDTO inbound;
        try {
            inbound = objectMapper.readValue(payload, ChatInboundMessageDTO.class);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "消息格式错误，应为 {\"message\": \"...\"}");
        }
        if (inbound == null || StringUtils.isBlank(inbound.getMessage())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "message不能为空");
        }
        return inbound.getMessage().trim();
    }

    private List<String> toolNames(List<PlannedAction> plannedActions) {
        List<String> names = new ArrayList<>();
        for (PlannedAction action : plannedActions) {
            if (StringUtils.isNotBlank(action.getToolName())) {
                names.add(action.getToolName());
            }
        }
        return names;
    }

    private String summarize(PlanExecutionResult result) {
        if (result.getStatus() == PlanStatusEnum.COMPLETED) {
            return "Plan " + result.getPlanId() + " completed with " + result.getActions().size() + " actions";
        }
        return "Plan " + result.getPlanId() + " failed: " + result.getError();
    }
}
