package com.wangbin.edge.common.domain.dto.meta;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class UpdateAssetTemplateRequest {

    private String id;

    /** 为空表示解除模板绑定 */
    @JsonProperty("template_name")
    @JsonAlias("templateName")
    private String templateName;
}
