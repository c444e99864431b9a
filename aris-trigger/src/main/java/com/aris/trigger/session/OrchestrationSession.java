package com.aris.trigger.session;

import com.aris.domain.session.model.entity.SessionContextEntity;
import com.aris.domain.tool.adapter.gateway.IToolRouter;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单个客户端连接的编排会话。
 * <p>
 * 出站事件先进入队列，由持有发送锁的线程按入队顺序写出；同一会话的消息通过回合锁串行处理。
 * 关闭后不再启动新动作，工具路由在进行中的回合结束后释放。
 * </p>
 */
@Slf4j
public class OrchestrationSession {

    @Getter
    private final SessionContextEntity context;

    @Getter
    private final IToolRouter toolRouter;

    private final ISessionOutbound outbound;

    private final BlockingQueue<Object> outboundQueue = new LinkedBlockingQueue<>();

    private final ReentrantLock sendLock = new ReentrantLock();

    private final ReentrantLock turnLock = new ReentrantLock();

    public OrchestrationSession(SessionContextEntity context, IToolRouter toolRouter, ISessionOutbound outbound) {
        this.context = context;
        this.toolRouter = toolRouter;
        this.outbound = outbound;
    }

    public String getSessionId() {
        return context.getSessionId();
    }

    public String getChatId() {
        return context.getChatId();
    }

    public boolean isClosed() {
        return context.isClosed();
    }

    /**
     * 入队并尝试写出。关闭后的事件直接丢弃。
     */
    public void emit(Object event) {
        if (event == null || isClosed()) {
            return;
        }
        outboundQueue.offer(event);
        flush();
    }

    void lockTurn() {
        turnLock.lock();
    }

    void unlockTurn() {
        turnLock.unlock();
    }

    /**
     * 标记关闭；没有进行中的回合时立即释放工具路由。
     *
     * @return 是否已释放工具路由
     */
    boolean close() {
        context.close();
        outboundQueue.clear();
        if (turnLock.tryLock()) {
            try {
                toolRouter.close();
                return true;
            } finally {
                turnLock.unlock();
            }
        }
        return false;
    }

    private void flush() {
        while (!outboundQueue.isEmpty()) {
            if (!sendLock.tryLock()) {
                return;
            }
            try {
                Object next;
                while ((next = outboundQueue.poll()) != null) {
                    send(next);
                }
            } finally {
                sendLock.unlock();
            }
        }
    }

    private void send(Object event) {
        if (!outbound.isOpen()) {
            return;
        }
        try {
            outbound.send(event);
        } catch (IOException | RuntimeException ex) {
            log.warn("Failed to send session event sessionId={}, error={}", getSessionId(), ex.getMessage());
        }
    }
}
