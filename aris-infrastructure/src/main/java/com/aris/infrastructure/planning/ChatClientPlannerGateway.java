package com.aris.infrastructure.planning;

import com.aris.domain.planning.adapter.gateway.IPlannerGateway;
import com.aris.domain.planning.model.valobj.PlannedAction;
import com.aris.domain.planning.service.PlanDraftParseDomainService;
import com.aris.domain.session.model.valobj.ChatHistoryMessage;
import com.aris.infrastructure.mcp.config.ToolServerProperties;
import com.aris.infrastructure.util.JsonCodec;
import com.aris.types.enums.ResponseCode;
import com.aris.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * 基于 Spring AI ChatClient 的规划器实现。
 * <p>
 * 提示词包含已配置的工具目录与模板占位符语法，模型只返回
 * {"actions":[{"id","tool_name","arguments","result_variable_name"}]}。
 * </p>
 */
@Slf4j
@Component
public class ChatClientPlannerGateway implements IPlannerGateway {

    private final ChatClient chatClient;
    private final ToolServerProperties toolServerProperties;
    private final PlanDraftParseDomainService planDraftParseDomainService;
    private final JsonCodec jsonCodec;
    private final String extraInstructions;

    public ChatClientPlannerGateway(ChatClient.Builder chatClientBuilder,
                                    ToolServerProperties toolServerProperties,
                                    PlanDraftParseDomainService planDraftParseDomainService,
                                    JsonCodec jsonCodec,
                                    @Value("${aris.planner.extra-instructions:}") String extraInstructions) {
        this.chatClient = chatClientBuilder.build();
        this.toolServerProperties = toolServerProperties;
        this.planDraftParseDomainService = planDraftParseDomainService;
        this.jsonCodec = jsonCodec;
        this.extraInstructions = extraInstructions;
    }

    @Override
    public List<PlannedAction> plan(String userQuery, List<ChatHistoryMessage> chatHistory) {
        if (StringUtils.isBlank(userQuery)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "用户输入为空，无法生成执行计划");
        }
        String content = chatClient.prompt()
                .system(buildSystemPrompt())
                .user(buildUserPrompt(userQuery, chatHistory))
                .call()
                .content();
        if (StringUtils.isBlank(content)) {
            throw new AppException(ResponseCode.UN_ERROR, "规划器返回为空");
        }
        Map<String, Object> draft = planDraftParseDomainService.parseEmbeddedJsonObject(content, jsonCodec::readObject);
        if (draft == null) {
            throw new AppException(ResponseCode.UN_ERROR, "规划结果不是有效 JSON");
        }
        List<PlannedAction> actions = planDraftParseDomainService.toPlannedActions(draft);
        log.info("PLANNER_DRAFT_PARSED actions={}, queryLength={}", actions.size(), userQuery.length());
        return actions;
    }

    private String buildSystemPrompt() {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a planner. Break the user request into an ordered list of tool calls and return JSON only.\n");
        prompt.append("Format: {\"actions\":[{\"id\":\"action_1\",\"tool_name\":\"...\",\"arguments\":{},")
                .append("\"result_variable_name\":\"optional_name\"}]}\n");
        prompt.append("Reference earlier results with {{identifier.path}} placeholders, e.g. {{action_1.result.id}}, ")
                .append("{{previous.result}}, {{pdf.filename}} or a result_variable_name. ")
                .append("A placeholder that is the whole argument value keeps its original type.\n");
        prompt.append("Available tools:\n");
        for (ToolServerProperties.Server server : toolServerProperties.getServers()) {
            for (String tool : server.getTools()) {
                prompt.append("- ").append(tool);
                String description = server.getToolDescriptions().get(tool);
                if (StringUtils.isNotBlank(description)) {
                    prompt.append(": ").append(description);
                }
                prompt.append('\n');
            }
        }
        if (StringUtils.isNotBlank(extraInstructions)) {
            prompt.append(extraInstructions);
        }
        return prompt.toString();
    }

    private String buildUserPrompt(String userQuery, List<ChatHistoryMessage> chatHistory) {
        if (chatHistory == null || chatHistory.isEmpty()) {
            return userQuery;
        }
        StringBuilder prompt = new StringBuilder("Conversation so far:\n");
        for (ChatHistoryMessage item : chatHistory) {
            if (item == null || StringUtils.isBlank(item.getContent())) {
                continue;
            }
            prompt.append(item.getRole()).append(": ").append(item.getContent()).append('\n');
        }
        prompt.append("\nCurrent request:\n").append(userQuery);
        return prompt.toString();
    }
}
