package com.wangbin.edge.common.domain.dto.meta;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * 按 id 或 name 查询资产，id 优先
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GetAssetRequest {

    private String id;

    private String name;
}
