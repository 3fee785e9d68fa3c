package com.wangbin.edge.api.controller;

import com.wangbin.edge.core.bus.BusBridge;
import com.wangbin.edge.core.store.MetadataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 系统健康检查接口。
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController {

    static final String UP = "UP";
    static final String DOWN = "DOWN";
    static final String DISABLED = "DISABLED";

    private final MetadataStore metadataStore;
    private final ObjectProvider<BusBridge> busBridge;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        String store = checkStore();
        BusBridge bridge = busBridge.getIfAvailable();
        String bus = bridge == null ? DISABLED : (bridge.isConnected() ? UP : DOWN);

        boolean healthy = UP.equals(store) && !DOWN.equals(bus);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", healthy ? UP : DOWN);
        body.put("store", store);
        body.put("bus", bus);
        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private String checkStore() {
        try {
            metadataStore.countAssets();
            return UP;
        } catch (RuntimeException e) {
            log.warn("元数据存储不可用: {}", e.getMessage());
            return DOWN;
        }
    }
}
