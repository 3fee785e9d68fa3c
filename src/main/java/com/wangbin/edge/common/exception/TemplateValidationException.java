package com.wangbin.edge.common.exception;

import com.wangbin.edge.common.domain.enums.ValueType;
import com.wangbin.edge.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 点位值类型与模板声明不一致
 */
@Getter
public class TemplateValidationException extends BusinessException {

    private final String templateName;
    private final String tagName;
    private final ValueType expectedType;

    public TemplateValidationException(String templateName, String tagName, ValueType expectedType) {
        super(ResultCode.VALIDATION_FAILED, String.format("tag '%s' must be %s type", tagName, expectedType.name()));
        this.templateName = templateName;
        this.tagName = tagName;
        this.expectedType = expectedType;
    }
}
