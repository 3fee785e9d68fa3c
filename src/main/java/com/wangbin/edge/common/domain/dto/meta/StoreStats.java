package com.wangbin.edge.common.domain.dto.meta;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 元数据存储统计
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StoreStats {

    @JsonProperty("total_assets")
    private long totalAssets;

    @JsonProperty("total_relations")
    private long totalRelations;

    @JsonProperty("last_updated")
    private Instant lastUpdated;
}
