package com.wangbin.edge.common.domain.dto.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 一次数据上报：某资产在某时刻的一组点位值。仅用于校验、自动注册与转发，不持久化。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssetData {

    @JsonProperty("asset_id")
    private String assetId;

    /** 采集时间戳，原样透传 */
    private long timestamp;

    private List<TagValue> values = new ArrayList<>();

    private Map<String, String> metadata;
}
