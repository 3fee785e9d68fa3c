package com.wangbin.edge.common.domain.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 资产实体
 *
 * 已注册的物理或逻辑数据源（传感器、设备等）。id 创建后不可变，templateName 可修改。
 * createdAt 按原精度持久化。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Asset {

    /** 全局唯一标识 */
    private String id;

    /** 唯一名称 */
    private String name;

    /** 绑定的模板名称，可为空 */
    @JsonProperty("template_name")
    private String templateName;

    /** 标签 */
    @Builder.Default
    private List<String> labels = new ArrayList<>();

    /** 创建时间 */
    @JsonProperty("created_at")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private Instant createdAt;
}
