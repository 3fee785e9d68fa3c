package com.wangbin.edge.common.exception;

import com.wangbin.edge.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 业务异常
 *
 * 所有领域错误的基类，{@link #getMessage()} 会原样返回给管理接口的调用方。
 */
@Getter
public class BusinessException extends RuntimeException {

    private final int code;

    public BusinessException(ResultCode resultCode, String message) {
        super(message);
        this.code = resultCode.getCode();
    }

    public BusinessException(ResultCode resultCode, String message, Throwable cause) {
        super(message, cause);
        this.code = resultCode.getCode();
    }
}
