package com.wangbin.edge.core.config;

import com.wangbin.edge.common.constant.TopicConstant;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 边缘核心配置类
 */
@Data
@Component
@ConfigurationProperties(prefix = "edge")
public class EdgeProperties {

    /**
     * MQTT配置
     */
    private MqttConfig mqtt = new MqttConfig();

    /**
     * 元数据存储配置
     */
    private StoreConfig store = new StoreConfig();

    /**
     * 资产模板配置
     */
    private TemplateConfig template = new TemplateConfig();

    /**
     * 数据接入配置
     */
    private IngestConfig ingest = new IngestConfig();

    /**
     * 管理接口配置
     */
    private MetaConfig meta = new MetaConfig();

    // =============== 配置类定义 ===============

    @Data
    public static class MqttConfig {
        private boolean enabled = true;
        private String brokerUrl = "tcp://localhost:1883";
        private String clientId;
        private String username;
        private String password;
        private int qos = 1;
        private boolean cleanStart = true;
        private int connectionTimeout = 30;
        private int keepAliveInterval = 60;
        private boolean automaticReconnect = true;
        private long completionTimeout = 5000L;
        /** 首次连接失败后的重试间隔，按倍数递增至上限 */
        private long initialReconnectDelay = 1000L;
        private long maxReconnectDelay = 60000L;
    }

    @Data
    public static class StoreConfig {
        private String dbPath = "./data/metadata.db";
        private int busyTimeout = 5000;
    }

    @Data
    public static class TemplateConfig {
        private String dir = "./templates";
        private boolean failOnError = false;
    }

    @Data
    public static class IngestConfig {
        private String subject = TopicConstant.DATA_ASSET;
        private String forwardSubject = TopicConstant.DATA_VALIDATED;
        private boolean forwardEnabled = true;
        private boolean validate = true;
        private int bufferCapacity = 0;
    }

    @Data
    public static class MetaConfig {
        private String subjectPrefix = TopicConstant.META_PREFIX;
    }
}
