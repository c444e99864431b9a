package com.aris.trigger.session;

import java.io.IOException;

/**
 * 会话的出站通道。实现无需线程安全，调用方保证同一时刻只有一个发送者。
 */
public interface ISessionOutbound {

    void send(Object event) throws IOException;

    boolean isOpen();
}
