package com.wangbin.edge.common.utils;

import java.util.UUID;

/**
 * ID生成器工具类
 */
public class IdGenerator {

    private IdGenerator() {
        // 工具类，防止实例化
    }

    /**
     * 生成UUID（带横线）
     */
    public static String generateUuidWithDash() {
        return UUID.randomUUID().toString();
    }

    /**
     * 生成UUID（不带横线）
     */
    public static String generateUuid() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
