package com.wangbin.edge.core.config;

import com.wangbin.edge.common.exception.TemplateLoadException;
import com.wangbin.edge.core.bus.BusBridge;
import com.wangbin.edge.core.bus.MqttClientAdapter;
import com.wangbin.edge.core.bus.MqttConnectionConfig;
import com.wangbin.edge.core.bus.PahoV5ClientAdapter;
import com.wangbin.edge.core.ingest.IngestionPipeline;
import com.wangbin.edge.core.meta.MetaRequestHandler;
import com.wangbin.edge.core.store.MetadataStore;
import com.wangbin.edge.core.store.SqliteMetadataStore;
import com.wangbin.edge.core.template.TemplateRegistry;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.mqttv5.common.MqttException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * 核心组件装配：存储、模板注册表、接入管道、管理接口、总线
 */
@Slf4j
@Configuration
public class EdgeCoreConfiguration {

    @Bean(destroyMethod = "close")
    public MetadataStore metadataStore(EdgeProperties properties) {
        EdgeProperties.StoreConfig store = properties.getStore();
        log.info("打开元数据存储: {}", store.getDbPath());
        return new SqliteMetadataStore(store.getDbPath(), store.getBusyTimeout());
    }

    @Bean
    public TemplateRegistry templateRegistry(EdgeProperties properties) {
        EdgeProperties.TemplateConfig template = properties.getTemplate();
        TemplateRegistry registry = new TemplateRegistry();
        try {
            registry.load(Path.of(template.getDir()));
        } catch (TemplateLoadException e) {
            if (template.isFailOnError()) {
                throw e;
            }
            log.warn("模板加载失败，继续启动，已加载 {} 个模板: {}", registry.count(), e.getMessage());
        }
        return registry;
    }

    @Bean(destroyMethod = "")
    @ConditionalOnProperty(name = "edge.mqtt.enabled", havingValue = "true", matchIfMissing = true)
    public MqttClientAdapter mqttClientAdapter(EdgeProperties properties) throws MqttException {
        return new PahoV5ClientAdapter(MqttConnectionConfig.from(properties.getMqtt()));
    }

    @Bean
    public IngestionPipeline ingestionPipeline(EdgeProperties properties,
                                               MetadataStore metadataStore,
                                               TemplateRegistry templateRegistry,
                                               ObjectProvider<MqttClientAdapter> mqttClientAdapter) {
        EdgeProperties.IngestConfig ingest = properties.getIngest();
        return IngestionPipeline.builder()
                .store(metadataStore)
                .templateRegistry(templateRegistry)
                .forwarder(ingest.isForwardEnabled() ? mqttClientAdapter.getIfAvailable() : null)
                .forwardTopic(ingest.getForwardSubject())
                .forwardQos(1)
                .validate(ingest.isValidate())
                .bufferCapacity(ingest.getBufferCapacity())
                .build();
    }

    @Bean
    public MetaRequestHandler metaRequestHandler(MetadataStore metadataStore,
                                                 TemplateRegistry templateRegistry,
                                                 IngestionPipeline ingestionPipeline) {
        return new MetaRequestHandler(metadataStore, templateRegistry, ingestionPipeline);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(name = "edge.mqtt.enabled", havingValue = "true", matchIfMissing = true)
    public BusBridge busBridge(EdgeProperties properties,
                               MqttClientAdapter mqttClientAdapter,
                               IngestionPipeline ingestionPipeline,
                               MetaRequestHandler metaRequestHandler) {
        return new BusBridge(mqttClientAdapter, ingestionPipeline, metaRequestHandler,
                properties.getIngest().getSubject(),
                properties.getMeta().getSubjectPrefix(),
                MqttConnectionConfig.from(properties.getMqtt()).getDefaultQos(),
                properties.getMqtt().getInitialReconnectDelay(),
                properties.getMqtt().getMaxReconnectDelay());
    }
}
