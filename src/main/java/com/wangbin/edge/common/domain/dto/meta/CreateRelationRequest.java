package com.wangbin.edge.common.domain.dto.meta;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateRelationRequest {

    @JsonProperty("source_asset_id")
    @JsonAlias("sourceAssetId")
    private String sourceAssetId;

    @JsonProperty("target_asset_id")
    @JsonAlias("targetAssetId")
    private String targetAssetId;

    /** 保持字符串，便于返回 invalid relation_type */
    @JsonProperty("relation_type")
    @JsonAlias("relationType")
    private String relationType;

    private Map<String, String> metadata;
}
