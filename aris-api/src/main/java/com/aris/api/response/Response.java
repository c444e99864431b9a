package com.aris.api.response;

import com.aris.types.enums.ResponseCode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 查询 API 的统一响应体。
 * <p>
 * code 取自 {@link ResponseCode}，失败时 data 为空，info 携带可读的失败原因。
 * </p>
 *
 * @param <T> 响应数据的类型
 * @author getoffer
 * @since 2025-01-29
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 7000723935764546321L;

    private String code;

    private String info;

    private T data;

    public static <T> Response<T> ok(T data) {
        return new Response<>(ResponseCode.SUCCESS.getCode(), ResponseCode.SUCCESS.getInfo(), data);
    }

    public static <T> Response<T> fail(ResponseCode responseCode, String info) {
        return fail(responseCode.getCode(), info == null ? responseCode.getInfo() : info);
    }

    public static <T> Response<T> fail(String code, String info) {
        return new Response<>(code, info, null);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return ResponseCode.SUCCESS.getCode().equals(code);
    }

}
