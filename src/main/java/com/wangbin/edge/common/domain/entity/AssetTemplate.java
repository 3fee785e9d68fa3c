package com.wangbin.edge.common.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 资产模板：某一类资产应上报的点位名称与类型
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssetTemplate {

    private String name;

    private List<AssetResource> resources = new ArrayList<>();
}
