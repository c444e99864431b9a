package com.aris.domain.planning.adapter.gateway;

import com.aris.domain.planning.model.valobj.ActionProgressEvent;

/**
 * 计划执行进度监听。实现方不得阻塞执行线程。
 */
@FunctionalInterface
public interface IPlanProgressListener {

    void onActionTransition(ActionProgressEvent event);
}
