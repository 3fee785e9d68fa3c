package com.wangbin.edge.common.exception;

import com.wangbin.edge.common.domain.enums.RelationType;
import com.wangbin.edge.common.web.result.ResultCode;

/**
 * 同一 (source, target, type) 的关系已存在
 */
public class DuplicateRelationException extends BusinessException {

    public DuplicateRelationException(String message) {
        super(ResultCode.DATA_EXISTS, message);
    }

    public static DuplicateRelationException of(String sourceAssetId, String targetAssetId, RelationType type) {
        return new DuplicateRelationException(String.format("relation already exists: %s -[%s]-> %s",
                sourceAssetId, type.getValue(), targetAssetId));
    }
}
