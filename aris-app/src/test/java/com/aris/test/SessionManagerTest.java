package com.aris.test;

import com.aris.api.dto.ActionStatusEventDTO;
import com.aris.api.dto.ErrorEventDTO;
import com.aris.api.dto.PlanResultEventDTO;
import com.aris.domain.memory.service.MemoryStoreDomainService;
import com.aris.domain.memory.service.MemoryTagDomainService;
import com.aris.domain.planning.adapter.gateway.IPlannerGateway;
import com.aris.domain.planning.model.entity.PlanEntity;
import com.aris.domain.planning.model.valobj.PlannedAction;
import com.aris.domain.planning.service.PlanAssemblyDomainService;
import com.aris.domain.planning.service.PlanTransitionDomainService;
import com.aris.domain.session.model.valobj.ChatHistoryMessage;
import com.aris.domain.template.service.TemplateResolverDomainService;
import com.aris.domain.tool.adapter.gateway.IToolRouterFactory;
import com.aris.test.support.InMemoryChatRepository;
import com.aris.test.support.InMemoryMemoryEntryRepository;
import com.aris.test.support.InMemoryPlanStore;
import com.aris.test.support.NoSleepToolCallDomainService;
import com.aris.test.support.ScriptedToolRouter;
import com.aris.trigger.application.command.PlanManagerApplicationService;
import com.aris.trigger.application.common.PlanViewAssembler;
import com.aris.trigger.config.ExecutionProperties;
import com.aris.trigger.session.ISessionOutbound;
import com.aris.trigger.session.OrchestrationSession;
import com.aris.trigger.session.SessionManager;
import com.aris.types.common.Constants;
import com.aris.types.enums.PlanStatusEnum;
import com.aris.types.enums.ResponseCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class SessionManagerTest {

    private InMemoryPlanStore planStore;
    private InMemoryChatRepository chatRepository;
    private IPlannerGateway plannerGateway;
    private ScriptedToolRouter router;
    private ThreadPoolExecutor worker;
    private SessionManager sessionManager;

    @BeforeEach
    public void setUp() {
        planStore = new InMemoryPlanStore();
        chatRepository = new InMemoryChatRepository();
        plannerGateway = mock(IPlannerGateway.class);
        router = new ScriptedToolRouter();
        IToolRouterFactory routerFactory = mock(IToolRouterFactory.class);
        when(routerFactory.create(anyString(), anyString())).thenReturn(router);

        ExecutionProperties properties = new ExecutionProperties();
        properties.setMaxRetries(0);
        ObjectMapper objectMapper = new ObjectMapper();
        PlanManagerApplicationService planManager = new PlanManagerApplicationService(
                planStore.planRepository(),
                planStore.actionRepository(),
                new PlanAssemblyDomainService(),
                new PlanTransitionDomainService(),
                new TemplateResolverDomainService(),
                new NoSleepToolCallDomainService(),
                new MemoryStoreDomainService(new InMemoryMemoryEntryRepository(), new MemoryTagDomainService()),
                properties,
                objectMapper);
        worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>());
        sessionManager = new SessionManager(routerFactory, plannerGateway, chatRepository, planManager,
                new PlanViewAssembler(), properties, objectMapper, worker);
    }

    @AfterEach
    public void tearDown() {
        worker.shutdownNow();
    }

    @Test
    public void shouldStreamStatusEventsBeforeResult() throws Exception {
        router.returning("get_user_profile", Map.of("email", "bob@example.com"))
                .returning("send_email", Map.of("message_id", "m-1"));
        when(plannerGateway.plan(eq("email bob"), anyList())).thenReturn(Arrays.asList(
                planned("step1", "get_user_profile", Map.of("user_id", "bob")),
                planned(null, "send_email", Map.of("to", "{{step1.email}}"))));
        RecordingOutbound outbound = new RecordingOutbound();
        sessionManager.open("s-1", "chat-1", outbound);

        sessionManager.handleMessage("s-1", "{\"message\":\"email bob\"}");
        awaitWorker();

        List<Object> events = outbound.events;
        Assertions.assertEquals(7, events.size());
        for (int i = 0; i < 6; i++) {
            Assertions.assertInstanceOf(ActionStatusEventDTO.class, events.get(i));
        }
        ActionStatusEventDTO first = (ActionStatusEventDTO) events.get(0);
        Assertions.assertEquals("starting", first.getStatus());
        Assertions.assertEquals(0, first.getOrderIndex());
        PlanResultEventDTO result = (PlanResultEventDTO) events.get(6);
        Assertions.assertEquals("completed", result.getPlanStatus());
        Assertions.assertEquals(2, result.getActions().size());
        Assertions.assertEquals(Arrays.asList("get_user_profile", "send_email"), router.prepared());
        Assertions.assertNotNull(chatRepository.findById("chat-1"));
    }

    @Test
    public void shouldEmitErrorForMalformedMessage() {
        RecordingOutbound outbound = new RecordingOutbound();
        sessionManager.open("s-1", "chat-1", outbound);

        sessionManager.handleMessage("s-1", "not json");
        sessionManager.handleMessage("s-1", "{\"message\":\"  \"}");

        Assertions.assertEquals(2, outbound.events.size());
        ErrorEventDTO error = (ErrorEventDTO) outbound.events.get(0);
        Assertions.assertEquals("error", error.getType());
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), error.getCode());
        verify(plannerGateway, never()).plan(anyString(), anyList());
    }

    @Test
    public void shouldEmitErrorWhenPlannerReturnsNoActions() {
        when(plannerGateway.plan(anyString(), anyList())).thenReturn(Collections.emptyList());
        RecordingOutbound outbound = new RecordingOutbound();
        OrchestrationSession session = sessionManager.open("s-1", "chat-1", outbound);

        sessionManager.processTurn(session, "hello");

        Assertions.assertEquals(1, outbound.events.size());
        Assertions.assertInstanceOf(ErrorEventDTO.class, outbound.events.get(0));
        Assertions.assertEquals(0, planStore.planCount());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void shouldPassHistoryToLaterTurns() {
        router.returning("a", Map.of());
        when(plannerGateway.plan(anyString(), anyList()))
                .thenReturn(Collections.singletonList(planned(null, "a", Map.of())));
        OrchestrationSession session = sessionManager.open("s-1", "chat-1", new RecordingOutbound());

        sessionManager.processTurn(session, "first");
        sessionManager.processTurn(session, "second");

        ArgumentCaptor<List<ChatHistoryMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(plannerGateway, times(2)).plan(anyString(), captor.capture());
        Assertions.assertTrue(captor.getAllValues().get(0).isEmpty());
        List<ChatHistoryMessage> history = captor.getAllValues().get(1);
        Assertions.assertEquals(2, history.size());
        Assertions.assertEquals("first", history.get(0).getContent());
        Assertions.assertEquals(ChatHistoryMessage.ROLE_ASSISTANT, history.get(1).getRole());
    }

    @Test
    public void shouldReleaseRouterWhenIdleSessionCloses() {
        RecordingOutbound outbound = new RecordingOutbound();
        OrchestrationSession session = sessionManager.open("s-1", "chat-1", outbound);

        sessionManager.close("s-1");
        session.emit(new ErrorEventDTO("0001", "late"));

        Assertions.assertTrue(router.isClosed());
        Assertions.assertNull(sessionManager.getSession("s-1"));
        Assertions.assertTrue(outbound.events.isEmpty());
    }

    @Test
    public void shouldStopPlanAndReleaseRouterAfterTurnWhenClosedMidPlan() {
        AtomicBoolean closedDuringTurn = new AtomicBoolean();
        router.on("a", args -> {
            disconnect("s-1");
            closedDuringTurn.set(router.isClosed());
            return new LinkedHashMap<>(Map.of("ok", true));
        }).returning("b", Map.of());
        when(plannerGateway.plan(anyString(), anyList())).thenReturn(Arrays.asList(
                planned(null, "a", Map.of()), planned(null, "b", Map.of())));
        OrchestrationSession session = sessionManager.open("s-1", "chat-1", new RecordingOutbound());

        sessionManager.processTurn(session, "go");

        Assertions.assertFalse(closedDuringTurn.get());
        Assertions.assertTrue(router.isClosed());
        Assertions.assertEquals(1, router.calls().size());
        String planId = planStore.planRepository().findByChatId("chat-1").get(0).getId();
        Assertions.assertEquals(Constants.CONNECTION_CLOSED_REASON,
                planStore.planRepository().findById(planId).getErrorSummary());
    }

    @Test
    public void shouldNotCreatePlanWhenClosedDuringPlanning() {
        RecordingOutbound outbound = new RecordingOutbound();
        when(plannerGateway.plan(anyString(), anyList())).thenAnswer(invocation -> {
            disconnect("s-1");
            return Collections.singletonList(planned(null, "a", Map.of()));
        });
        router.returning("a", Map.of());
        OrchestrationSession session = sessionManager.open("s-1", "chat-1", outbound);

        sessionManager.processTurn(session, "go");

        Assertions.assertEquals(0, planStore.planCount());
        Assertions.assertEquals(0, planStore.actionCount());
        Assertions.assertTrue(router.calls().isEmpty());
        Assertions.assertTrue(router.prepared().isEmpty());
        Assertions.assertTrue(router.isClosed());
        Assertions.assertTrue(outbound.events.isEmpty());
    }

    @Test
    public void shouldFailPersistedPlanWhenClosedWhileConnecting() {
        router.returning("a", Map.of()).onPrepare(() -> disconnect("s-1"));
        when(plannerGateway.plan(anyString(), anyList()))
                .thenReturn(Collections.singletonList(planned(null, "a", Map.of())));
        OrchestrationSession session = sessionManager.open("s-1", "chat-1", new RecordingOutbound());

        sessionManager.processTurn(session, "go");

        Assertions.assertTrue(router.calls().isEmpty());
        Assertions.assertTrue(router.isClosed());
        PlanEntity plan = planStore.planRepository().findByChatId("chat-1").get(0);
        Assertions.assertEquals(PlanStatusEnum.FAILED, plan.getStatus());
        Assertions.assertEquals(Constants.CONNECTION_CLOSED_REASON, plan.getErrorSummary());
    }

    @Test
    public void shouldIgnoreMessagesForUnknownSession() {
        sessionManager.handleMessage("missing", "{\"message\":\"hi\"}");

        verify(plannerGateway, never()).plan(any(), any());
    }

    /**
     * 断开连接发生在容器线程上，与回合线程不同。
     */
    private void disconnect(String sessionId) {
        Thread disconnect = new Thread(() -> sessionManager.close(sessionId));
        disconnect.start();
        try {
            disconnect.join(5000);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private void awaitWorker() throws InterruptedException {
        worker.shutdown();
        Assertions.assertTrue(worker.awaitTermination(10, TimeUnit.SECONDS));
    }

    private PlannedAction planned(String id, String tool, Map<String, Object> arguments) {
        return PlannedAction.builder().id(id).toolName(tool).arguments(new LinkedHashMap<>(arguments)).build();
    }

    private static class RecordingOutbound implements ISessionOutbound {

        private final List<Object> events = new CopyOnWriteArrayList<>();

        @Override
        public void send(Object event) {
            events.add(event);
        }

        @Override
        public boolean isOpen() {
            return true;
        }
    }
}
