package com.wangbin.edge.common.exception;

import com.wangbin.edge.common.web.result.ResultCode;

/**
 * 资产名称或ID重复
 */
public class DuplicateAssetException extends BusinessException {

    public DuplicateAssetException(String message) {
        super(ResultCode.DATA_EXISTS, message);
    }

    public static DuplicateAssetException ofName(String name) {
        return new DuplicateAssetException("asset name already exists: " + name);
    }

    public static DuplicateAssetException ofId(String id) {
        return new DuplicateAssetException("asset id already exists: " + id);
    }
}
