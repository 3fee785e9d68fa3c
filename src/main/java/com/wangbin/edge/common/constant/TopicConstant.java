package com.wangbin.edge.common.constant;

public class TopicConstant {

    // 数据接入
    public static final String DATA_ASSET = "platform.data.asset";
    public static final String DATA_VALIDATED = "platform.data.validated";

    // 管理接口前缀，完整主题为 前缀 + 操作名
    public static final String META_PREFIX = "platform.meta.";

    // 管理接口操作名
    public static final String OP_ASSET_CREATE = "asset.create";
    public static final String OP_ASSET_GET = "asset.get";
    public static final String OP_ASSET_LIST = "asset.list";
    public static final String OP_ASSET_DELETE = "asset.delete";
    public static final String OP_ASSET_UPDATE = "asset.update";
    public static final String OP_TEMPLATE_LIST = "template.list";
    public static final String OP_RELATION_CREATE = "relation.create";
    public static final String OP_RELATION_GET = "relation.get";
    public static final String OP_RELATION_LIST = "relation.list";
    public static final String OP_RELATION_DELETE = "relation.delete";
    public static final String OP_STATS = "meta.stats";

    private TopicConstant() {
    }
}
