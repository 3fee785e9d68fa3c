package com.wangbin.edge.common.exception;

import com.wangbin.edge.common.web.result.ResultCode;

/**
 * 关系不存在
 */
public class RelationNotFoundException extends BusinessException {

    public RelationNotFoundException(String relationId) {
        super(ResultCode.DATA_NOT_FOUND, "relation not found: " + relationId);
    }
}
