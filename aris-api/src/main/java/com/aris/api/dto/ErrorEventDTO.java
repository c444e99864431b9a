package com.aris.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 错误事件：请求在进入执行前失败（参数错误、持久化失败等）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorEventDTO {

    private String type = "error";

    private String code;

    private String message;

    public ErrorEventDTO(String code, String message) {
        this.code = code;
        this.message = message;
    }
}
