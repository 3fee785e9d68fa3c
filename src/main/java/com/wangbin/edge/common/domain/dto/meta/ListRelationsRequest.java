package com.wangbin.edge.common.domain.dto.meta;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ListRelationsRequest {

    @JsonProperty("asset_id")
    @JsonAlias("assetId")
    private String assetId;

    @JsonProperty("relation_type")
    @JsonAlias("relationType")
    private String relationType;

    /** outgoing / incoming / both，默认 both */
    private String direction;
}
