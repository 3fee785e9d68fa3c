package com.wangbin.edge.common.domain.dto.meta;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * 仅携带 id 的请求（asset.delete / relation.get / relation.delete）
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class IdRequest {

    private String id;
}
