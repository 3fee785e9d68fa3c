package com.wangbin.edge.common.exception;

import com.wangbin.edge.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 资产不存在
 */
@Getter
public class AssetNotFoundException extends BusinessException {

    /**
     * 创建关系时缺失的是哪一端
     */
    public enum Role {
        NONE, SOURCE, TARGET
    }

    private final String assetId;
    private final Role role;

    private AssetNotFoundException(String message, String assetId, Role role) {
        super(ResultCode.DATA_NOT_FOUND, message);
        this.assetId = assetId;
        this.role = role;
    }

    public static AssetNotFoundException of(String assetId) {
        return new AssetNotFoundException("asset not found: " + assetId, assetId, Role.NONE);
    }

    public static AssetNotFoundException source(String assetId) {
        return new AssetNotFoundException("source asset not found: " + assetId, assetId, Role.SOURCE);
    }

    public static AssetNotFoundException target(String assetId) {
        return new AssetNotFoundException("target asset not found: " + assetId, assetId, Role.TARGET);
    }
}
