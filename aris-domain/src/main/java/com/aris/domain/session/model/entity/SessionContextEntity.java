package com.aris.domain.session.model.entity;

import com.aris.domain.session.model.valobj.ChatHistoryMessage;
import com.aris.types.enums.SessionStateEnum;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 连接级会话上下文实体，仅存在于内存中。
 *
 * @author getoffer
 * @since 2025-02-05
 */
@Getter
public class SessionContextEntity {

    /**
     * 连接 ID
     */
    private final String sessionId;

    /**
     * 对话 ID (会话记忆的作用域)
     */
    private final String chatId;

    /**
     * 历史上限
     */
    private final int historyLimit;

    private final Deque<ChatHistoryMessage> history = new ArrayDeque<>();

    private final LocalDateTime createdAt;

    private volatile SessionStateEnum state;

    private volatile LocalDateTime lastActiveAt;

    public SessionContextEntity(String sessionId, String chatId, int historyLimit) {
        this.sessionId = sessionId;
        this.chatId = chatId;
        this.historyLimit = Math.max(historyLimit, 1);
        this.state = SessionStateEnum.IDLE;
        this.createdAt = LocalDateTime.now();
        this.lastActiveAt = this.createdAt;
    }

    /**
     * 开始处理一条消息：工具连接未建立时进入 INITIALIZING，否则直接 ACTIVE。
     */
    public synchronized void beginTurn(boolean toolConnectionsReady) {
        if (state != SessionStateEnum.IDLE) {
            throw new IllegalStateException("Session must be IDLE to begin a turn, current: " + state);
        }
        state = toolConnectionsReady ? SessionStateEnum.ACTIVE : SessionStateEnum.INITIALIZING;
        lastActiveAt = LocalDateTime.now();
    }

    /**
     * INITIALIZING → ACTIVE
     *
     * @return 会话已关闭时返回 false，状态保持 CLOSED
     */
    public synchronized boolean markActive() {
        if (state == SessionStateEnum.CLOSED) {
            return false;
        }
        if (state == SessionStateEnum.ACTIVE) {
            return true;
        }
        if (state != SessionStateEnum.INITIALIZING) {
            throw new IllegalStateException("Session must be INITIALIZING to become ACTIVE, current: " + state);
        }
        state = SessionStateEnum.ACTIVE;
        return true;
    }

    /**
     * 一轮结束后回到 IDLE，已关闭的会话保持 CLOSED。
     */
    public synchronized void endTurn() {
        if (state == SessionStateEnum.CLOSED) {
            return;
        }
        state = SessionStateEnum.IDLE;
        lastActiveAt = LocalDateTime.now();
    }

    public synchronized void close() {
        state = SessionStateEnum.CLOSED;
    }

    public boolean isClosed() {
        return state == SessionStateEnum.CLOSED;
    }

    public synchronized void appendHistory(String role, String content) {
        history.addLast(new ChatHistoryMessage(role, content));
        while (history.size() > historyLimit) {
            history.removeFirst();
        }
    }

    public synchronized List<ChatHistoryMessage> historySnapshot() {
        return new ArrayList<>(history);
    }
}
