package com.wangbin.edge.core.ingest;

import com.wangbin.edge.common.domain.dto.message.AssetData;
import com.wangbin.edge.common.domain.dto.message.TagValue;
import com.wangbin.edge.common.domain.entity.Asset;
import com.wangbin.edge.common.exception.DuplicateAssetException;
import com.wangbin.edge.common.exception.TemplateValidationException;
import com.wangbin.edge.common.utils.JsonUtil;
import com.wangbin.edge.core.bus.MqttClientAdapter;
import com.wangbin.edge.core.store.MetadataStore;
import com.wangbin.edge.core.template.TemplateRegistry;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 数据接入管道
 *
 * 每条上报依次执行：解码 -> 自动注册未知资产 -> 按模板校验 -> 写入内存缓冲 -> 转发到下游主题。
 * 任一步骤失败只记录日志，不影响后续步骤；解码失败则丢弃该条数据。
 * 可被多个生产者线程并发调用，缓冲区与计数由同一把锁保护。
 */
@Slf4j
public class IngestionPipeline {

    private final MetadataStore store;
    private final TemplateRegistry templateRegistry;
    private final MqttClientAdapter forwarder;
    private final String forwardTopic;
    private final int forwardQos;
    private final boolean validate;
    private final int bufferCapacity;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<AssetData> buffer = new ArrayDeque<>();
    private long processedCount;
    private long invalidCount;

    /**
     * @param store            为空时不做自动注册与校验
     * @param templateRegistry 为空时不做校验
     * @param forwarder        为空时不转发
     * @param bufferCapacity   0 表示不限，超出时淘汰最早的数据
     */
    @Builder
    public IngestionPipeline(MetadataStore store,
                             TemplateRegistry templateRegistry,
                             MqttClientAdapter forwarder,
                             String forwardTopic,
                             int forwardQos,
                             boolean validate,
                             int bufferCapacity) {
        this.store = store;
        this.templateRegistry = templateRegistry;
        this.forwarder = forwarder;
        this.forwardTopic = forwardTopic;
        this.forwardQos = forwardQos;
        this.validate = validate;
        this.bufferCapacity = Math.max(0, bufferCapacity);
    }

    /**
     * 处理一条上报，payload 为原始消息体
     */
    public void handle(byte[] payload) {
        // 1. 解码
        AssetData data = decode(payload);
        if (data == null) {
            return;
        }

        // 2. 自动注册
        if (store != null) {
            autoRegister(data.getAssetId());
        }

        // 3. 模板校验（可选）
        boolean valid = validateReading(data);

        // 4. 写入缓冲
        lock.lock();
        try {
            buffer.addLast(data);
            if (bufferCapacity > 0) {
                while (buffer.size() > bufferCapacity) {
                    buffer.pollFirst();
                }
            }
            processedCount++;
            if (!valid) {
                invalidCount++;
            }
        } finally {
            lock.unlock();
        }

        // 5. 原样转发
        forward(data.getAssetId(), payload);

        logReading(data);
    }

    public long getDataCount() {
        lock.lock();
        try {
            return processedCount;
        } finally {
            lock.unlock();
        }
    }

    public long getInvalidCount() {
        lock.lock();
        try {
            return invalidCount;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 当前缓冲内容的副本
     */
    public List<AssetData> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(buffer);
        } finally {
            lock.unlock();
        }
    }

    private AssetData decode(byte[] payload) {
        AssetData data = JsonUtil.parseObject(payload, AssetData.class);
        if (data == null) {
            log.warn("上报数据解析失败，已丢弃: {} 字节", payload != null ? payload.length : 0);
            return null;
        }
        if (data.getAssetId() == null || data.getAssetId().isBlank()) {
            log.warn("上报数据缺少 asset_id，已丢弃");
            return null;
        }
        if (data.getValues() == null) {
            data.setValues(new ArrayList<>());
        }
        if (data.getValues().contains(null)) {
            log.warn("上报数据 values 含空元素，已丢弃: {}", data.getAssetId());
            return null;
        }
        return data;
    }

    private void autoRegister(String assetId) {
        try {
            if (store.assetExists(assetId)) {
                return;
            }
            Asset asset = Asset.builder()
                    .id(assetId)
                    .name(assetId)
                    .createdAt(Instant.now())
                    .build();
            store.createAsset(asset);
            log.info("自动注册资产: {}", assetId);
        } catch (DuplicateAssetException e) {
            // 并发上报时可能已被其他线程注册，也可能与已有资产名称冲突
            log.warn("资产 {} 自动注册冲突: {}", assetId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("资产 {} 自动注册失败", assetId, e);
        }
    }

    private boolean validateReading(AssetData data) {
        if (!validate || store == null || templateRegistry == null || templateRegistry.count() == 0) {
            return true;
        }
        try {
            Optional<String> templateName = store.getAsset(data.getAssetId()).map(Asset::getTemplateName);
            if (templateName.isEmpty()) {
                return true;
            }
            templateRegistry.validate(templateName.get(), data);
            return true;
        } catch (TemplateValidationException e) {
            log.warn("资产 {} 数据不符合模板 {}: {}", data.getAssetId(), e.getTemplateName(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("资产 {} 模板校验异常", data.getAssetId(), e);
            return true;
        }
    }

    private void forward(String assetId, byte[] payload) {
        if (forwarder == null || forwardTopic == null) {
            return;
        }
        try {
            forwarder.publish(forwardTopic, payload, forwardQos, false);
        } catch (Exception e) {
            log.error("转发失败: {} -> {}", assetId, forwardTopic, e);
        }
    }

    private void logReading(AssetData data) {
        log.debug("资产: {}, 点位数: {}", data.getAssetId(), data.getValues().size());
        if (!log.isTraceEnabled()) {
            return;
        }
        for (TagValue tag : data.getValues()) {
            TagValue.Value value = tag.getValue();
            String unit = tag.getUnit() != null ? tag.getUnit() : "";
            if (value instanceof TagValue.NumberValue number) {
                log.trace("  ├─ {} = {} {} [{}]", tag.getName(), String.format("%.2f", number.number()), unit, tag.getQuality());
            } else if (value instanceof TagValue.TextValue text) {
                log.trace("  ├─ {} = \"{}\" [{}]", tag.getName(), text.text(), tag.getQuality());
            } else if (value instanceof TagValue.FlagValue flag) {
                log.trace("  ├─ {} = {} [{}]", tag.getName(), flag.flag(), tag.getQuality());
            } else {
                throw new IllegalStateException("unexpected tag value: " + value);
            }
        }
    }
}
