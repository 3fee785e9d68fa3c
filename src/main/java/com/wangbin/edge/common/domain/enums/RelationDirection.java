package com.wangbin.edge.common.domain.enums;

import java.util.Locale;

/**
 * 关系查询方向
 */
public enum RelationDirection {

    OUTGOING,
    INCOMING,
    BOTH;

    /**
     * 空值默认 BOTH，无法识别返回null
     */
    public static RelationDirection fromText(String text) {
        if (text == null || text.isBlank()) {
            return BOTH;
        }
        switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "outgoing":
                return OUTGOING;
            case "incoming":
                return INCOMING;
            case "both":
                return BOTH;
            default:
                return null;
        }
    }
}
