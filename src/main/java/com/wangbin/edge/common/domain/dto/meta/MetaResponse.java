package com.wangbin.edge.common.domain.dto.meta;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 管理接口统一应答：{success, data?, error?}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MetaResponse {

    /** 序列化失败时的兜底应答 */
    public static final String MARSHAL_FAILED = "internal error: response marshal failed";

    private boolean success;
    private Object data;
    private String error;

    public static MetaResponse ok() {
        return new MetaResponse(true, null, null);
    }

    public static MetaResponse ok(Object data) {
        return new MetaResponse(true, data, null);
    }

    public static MetaResponse fail(String error) {
        return new MetaResponse(false, null, error);
    }
}
