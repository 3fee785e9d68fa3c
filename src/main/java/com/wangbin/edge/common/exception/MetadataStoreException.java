package com.wangbin.edge.common.exception;

import com.wangbin.edge.common.web.result.ResultCode;

/**
 * 元数据存储异常
 *
 * 数据库访问失败，或持久化的 labels / metadata 无法反序列化时抛出。
 */
public class MetadataStoreException extends BusinessException {

    public MetadataStoreException(String message) {
        super(ResultCode.DATABASE_ERROR, message);
    }

    public MetadataStoreException(String message, Throwable cause) {
        super(ResultCode.DATABASE_ERROR, message, cause);
    }
}
