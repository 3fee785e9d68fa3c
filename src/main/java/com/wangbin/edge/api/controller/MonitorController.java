package com.wangbin.edge.api.controller;

import com.wangbin.edge.common.web.result.ApiResult;
import com.wangbin.edge.core.meta.MetaRequestHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 监控相关接口。
 */
@RestController
@RequestMapping("/api/monitor")
@RequiredArgsConstructor
public class MonitorController {

    private final MetaRequestHandler metaRequestHandler;

    @GetMapping("/stats")
    public ApiResult<Map<String, Object>> stats() {
        return ApiResult.success(metaRequestHandler.collectStats());
    }
}
