package com.wangbin.edge.common.web.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP监控接口的统一响应体
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResult<T> {

    private int code;
    private String message;
    private T data;
    private long timestamp = System.currentTimeMillis();
    private Map<String, Object> extra;

    private static <T> ApiResult<T> of(int code, String message, T data) {
        ApiResult<T> result = new ApiResult<>();
        result.code = code;
        result.message = message;
        result.data = data;
        return result;
    }

    public static <T> ApiResult<T> success(T data) {
        return of(ResultCode.SUCCESS.getCode(), ResultCode.SUCCESS.getMessage(), data);
    }

    public static <T> ApiResult<T> error(int code, String message) {
        return of(code, message, null);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return code == ResultCode.SUCCESS.getCode();
    }

    public ApiResult<T> addExtra(String key, Object value) {
        if (extra == null) {
            extra = new LinkedHashMap<>();
        }
        extra.put(key, value);
        return this;
    }
}
