package com.aris.trigger.http;

import com.aris.api.dto.MemoryEntryDTO;
import com.aris.api.dto.PlanDetailDTO;
import com.aris.api.response.Response;
import com.aris.trigger.application.query.PlanQueryService;
import com.aris.types.enums.ResponseCode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 计划与会话记忆查询 API。
 */
@RestController
@RequestMapping("/api/v1")
public class PlanQueryController {

    private final PlanQueryService planQueryService;

    public PlanQueryController(PlanQueryService planQueryService) {
        this.planQueryService = planQueryService;
    }

    @GetMapping("/plans/{planId}")
    public Response<PlanDetailDTO> getPlan(@PathVariable("planId") String planId) {
        if (StringUtils.isBlank(planId)) {
            return Response.fail(ResponseCode.ILLEGAL_PARAMETER, "planId不能为空");
        }
        return Response.ok(planQueryService.getPlan(planId));
    }

    @GetMapping("/chats/{chatId}/plans")
    public Response<List<PlanDetailDTO>> listPlans(@PathVariable("chatId") String chatId) {
        if (StringUtils.isBlank(chatId)) {
            return Response.fail(ResponseCode.ILLEGAL_PARAMETER, "chatId不能为空");
        }
        return Response.ok(planQueryService.listPlans(chatId));
    }

    @GetMapping("/chats/{chatId}/memory")
    public Response<List<MemoryEntryDTO>> searchMemory(@PathVariable("chatId") String chatId,
                                                       @RequestParam(value = "tool", required = false) String tool,
                                                       @RequestParam(value = "tag", required = false) String tag,
                                                       @RequestParam(value = "keyPattern", required = false) String keyPattern,
                                                       @RequestParam(value = "limit", required = false) Integer limit) {
        if (StringUtils.isBlank(chatId)) {
            return Response.fail(ResponseCode.ILLEGAL_PARAMETER, "chatId不能为空");
        }
        return Response.ok(planQueryService.searchMemory(chatId, tool, tag, keyPattern, limit));
    }

    @GetMapping("/chats/{chatId}/memory/{key}")
    public Response<MemoryEntryDTO> getMemory(@PathVariable("chatId") String chatId,
                                              @PathVariable("key") String key) {
        return Response.ok(planQueryService.getMemory(chatId, key));
    }
}
