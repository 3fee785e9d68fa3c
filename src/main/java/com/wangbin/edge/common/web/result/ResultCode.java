package com.wangbin.edge.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    // 成功
    SUCCESS(200, "成功"),

    // 业务错误
    DATA_NOT_FOUND(1001, "数据不存在"),
    DATA_EXISTS(1002, "数据已存在"),
    VALIDATION_FAILED(1005, "验证失败"),

    // 配置相关错误
    CONFIG_LOAD_ERROR(3003, "配置加载错误"),

    // 系统错误
    SYSTEM_ERROR(5000, "系统内部错误"),
    DATABASE_ERROR(5002, "数据库错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
