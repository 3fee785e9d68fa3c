package com.wangbin.edge.common.exception;

import com.wangbin.edge.common.web.result.ResultCode;

/**
 * 模板文件读取或解析失败
 */
public class TemplateLoadException extends BusinessException {

    public TemplateLoadException(String message) {
        super(ResultCode.CONFIG_LOAD_ERROR, message);
    }

    public TemplateLoadException(String message, Throwable cause) {
        super(ResultCode.CONFIG_LOAD_ERROR, message, cause);
    }
}
