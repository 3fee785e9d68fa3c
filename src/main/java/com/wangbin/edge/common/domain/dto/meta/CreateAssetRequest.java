package com.wangbin.edge.common.domain.dto.meta;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateAssetRequest {

    private String name;

    @JsonProperty("template_name")
    @JsonAlias("templateName")
    private String templateName;

    private List<String> labels;
}
