package com.aris.domain.planning.adapter.gateway;

import com.aris.domain.planning.model.valobj.PlannedAction;
import com.aris.domain.session.model.valobj.ChatHistoryMessage;

import java.util.List;

/**
 * 外部规划器：将用户请求转化为有序动作列表。
 */
public interface IPlannerGateway {

    /**
     * @param userQuery 用户请求
     * @param chatHistory 当前会话历史 (按时间顺序)
     * @return 有序动作列表，参数中可能包含未解析的模板占位符
     */
    List<PlannedAction> plan(String userQuery, List<ChatHistoryMessage> chatHistory);
}
