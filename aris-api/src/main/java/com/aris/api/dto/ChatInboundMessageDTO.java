package com.aris.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * 客户端上行消息：{"message": "..."}
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatInboundMessageDTO {

    private String message;
}
