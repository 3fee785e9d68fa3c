package com.wangbin.edge.common.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 资产之间的关系类型
 */
public enum RelationType {

    /** 层级关系，子资产属于父资产 */
    PART_OF("partOf"),
    /** 对等/网络连接 */
    CONNECTED_TO("connectedTo"),
    /** 空间包含 */
    LOCATED_IN("locatedIn");

    private final String value;

    RelationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 根据线上取值获取枚举，未知取值返回null
     */
    public static RelationType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (RelationType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        return null;
    }

    @JsonCreator
    static RelationType fromJson(String value) {
        RelationType type = fromValue(value);
        if (type == null) {
            throw new IllegalArgumentException("invalid relation_type: " + value);
        }
        return type;
    }
}
