package com.wangbin.edge.common.domain.enums;

/**
 * 模板资源声明的值类型，与点位值的三个变体一一对应
 */
public enum ValueType {

    /** 数值 */
    NUMBER,
    /** 文本 */
    TEXT,
    /** 布尔 */
    FLAG
}
