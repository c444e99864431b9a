package com.aris.trigger.websocket;

import com.aris.api.dto.ErrorEventDTO;
import com.aris.trigger.session.ISessionOutbound;
import com.aris.trigger.session.SessionManager;
import com.aris.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.UUID;

/**
 * 聊天 WebSocket 入口：连接建立时打开会话，文本帧作为入站消息，断开时关闭会话。
 * <p>
 * chat_id 取自连接 URL 的 chat_id 查询参数，缺省时生成新对话。
 * </p>
 */
@Slf4j
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private static final String CHAT_ID_PARAM = "chat_id";
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final SessionManager sessionManager;
    private final ObjectMapper objectMapper;

    public ChatWebSocketHandler(SessionManager sessionManager, ObjectMapper objectMapper) {
        this.sessionManager = sessionManager;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        String chatId = resolveChatId(session.getUri());
        try {
            sessionManager.open(session.getId(), chatId, new WebSocketOutbound(concurrent, objectMapper));
        } catch (AppException ex) {
            log.warn("Failed to open session sessionId={}, chatId={}, error={}", session.getId(), chatId, ex.getInfo());
            concurrent.sendMessage(new TextMessage(objectMapper.writeValueAsString(
                    new ErrorEventDTO(ex.getCode(), ex.getInfo()))));
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        sessionManager.handleMessage(session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error sessionId={}, error={}", session.getId(), exception.getMessage());
        sessionManager.close(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessionManager.close(session.getId());
    }

    String resolveChatId(URI uri) {
        if (uri != null) {
            String chatId = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(CHAT_ID_PARAM);
            if (StringUtils.isNotBlank(chatId)) {
                return chatId.trim();
            }
        }
        return UUID.randomUUID().toString();
    }

    private static final class WebSocketOutbound implements ISessionOutbound {

        private final WebSocketSession session;
        private final ObjectMapper objectMapper;

        private WebSocketOutbound(WebSocketSession session, ObjectMapper objectMapper) {
            this.session = session;
            this.objectMapper = objectMapper;
        }

        @Override
        public void send(Object event) throws IOException {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }
    }
}
