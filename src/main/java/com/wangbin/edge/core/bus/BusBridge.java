package com.wangbin.edge.core.bus;

import com.wangbin.edge.core.ingest.IngestionPipeline;
import com.wangbin.edge.core.meta.MetaRequestHandler;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 将接入管道与管理接口挂到消息总线上
 *
 * 订阅先于连接登记，连接建立后由客户端生效。首次连接失败不影响应用启动，
 * 按指数退避在后台重试直到成功或 {@link #stop()}；期间健康检查报告 DOWN。
 */
@Slf4j
public class BusBridge {

    public static final long DEFAULT_INITIAL_RECONNECT_DELAY = 1000L;
    public static final long DEFAULT_MAX_RECONNECT_DELAY = 60000L;

    private final MqttClientAdapter client;
    private final IngestionPipeline pipeline;
    private final MetaRequestHandler metaHandler;
    private final String ingestTopic;
    private final String metaPrefix;
    private final int qos;
    private final long initialReconnectDelay;
    private final long maxReconnectDelay;
    private final ScheduledExecutorService reconnectScheduler;

    private volatile boolean started;
    private volatile boolean stopped;
    private int connectAttempts;
    private long currentReconnectDelay;

    public BusBridge(MqttClientAdapter client,
                     IngestionPipeline pipeline,
                     MetaRequestHandler metaHandler,
                     String ingestTopic,
                     String metaPrefix,
                     int qos) {
        this(client, pipeline, metaHandler, ingestTopic, metaPrefix, qos,
                DEFAULT_INITIAL_RECONNECT_DELAY, DEFAULT_MAX_RECONNECT_DELAY);
    }

    public BusBridge(MqttClientAdapter client,
                     IngestionPipeline pipeline,
                     MetaRequestHandler metaHandler,
                     String ingestTopic,
                     String metaPrefix,
                     int qos,
                     long initialReconnectDelay,
                     long maxReconnectDelay) {
        this.client = client;
        this.pipeline = pipeline;
        this.metaHandler = metaHandler;
        this.ingestTopic = ingestTopic;
        this.metaPrefix = metaPrefix;
        this.qos = qos;
        this.initialReconnectDelay = Math.max(1L, initialReconnectDelay);
        this.maxReconnectDelay = Math.max(this.initialReconnectDelay, maxReconnectDelay);
        this.currentReconnectDelay = this.initialReconnectDelay;
        this.reconnectScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "bus-reconnect");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 登记全部订阅并尝试连接；连接成功返回true，失败时已安排后台重连
     */
    public boolean start() {
        try {
            client.subscribe(ingestTopic, qos, (topic, envelope) -> pipeline.handle(envelope.getPayload()));
            for (String operation : metaHandler.operations()) {
                client.subscribe(metaPrefix + operation, qos,
                        (topic, envelope) -> handleRequest(operation, envelope));
            }
        } catch (Exception e) {
            log.error("消息总线订阅登记失败", e);
            return false;
        }
        return connect();
    }

    public void stop() {
        stopped = true;
        started = false;
        reconnectScheduler.shutdownNow();
        try {
            client.disconnect();
            log.info("消息总线已断开");
        } catch (Exception e) {
            log.warn("消息总线断开失败", e);
        }
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isConnected() {
        return client.isConnected();
    }

    private synchronized boolean connect() {
        if (stopped) {
            return false;
        }
        connectAttempts++;
        try {
            client.connect();
        } catch (Exception e) {
            long delay = currentReconnectDelay;
            currentReconnectDelay = Math.min(maxReconnectDelay, currentReconnectDelay * 2);
            log.error("消息总线连接失败 (尝试 {})，{} 毫秒后重连", connectAttempts, delay, e);
            scheduleReconnect(delay);
            return false;
        }

        connectAttempts = 0;
        currentReconnectDelay = initialReconnectDelay;
        started = true;
        log.info("消息总线已就绪: 接入主题 {}, 管理接口 {} 个操作", ingestTopic, metaHandler.operations().size());
        return true;
    }

    private void scheduleReconnect(long delay) {
        if (stopped || reconnectScheduler.isShutdown()) {
            return;
        }
        reconnectScheduler.schedule(this::connect, delay, TimeUnit.MILLISECONDS);
    }

    void handleRequest(String operation, MqttMessageEnvelope envelope) {
        byte[] response = metaHandler.handle(operation, envelope.getPayload());
        try {
            if (!client.reply(envelope, response)) {
                log.debug("请求未携带响应主题，不回复: {}", operation);
            }
        } catch (Exception e) {
            log.error("应答发送失败: {}", operation, e);
        }
    }
}
