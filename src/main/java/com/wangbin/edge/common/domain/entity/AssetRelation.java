package com.wangbin.edge.common.domain.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.wangbin.edge.common.domain.enums.RelationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 资产关系：两个资产之间有向、带类型的边
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AssetRelation {

    private String id;

    @JsonProperty("source_asset_id")
    private String sourceAssetId;

    @JsonProperty("target_asset_id")
    private String targetAssetId;

    @JsonProperty("relation_type")
    private RelationType relationType;

    @JsonProperty("created_at")
    private Instant createdAt;

    /** 附加属性，可为空 */
    private Map<String, String> metadata;
}
