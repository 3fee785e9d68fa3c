package com.wangbin.edge.core.bus;

import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.mqttv5.client.IMqttToken;
import org.eclipse.paho.mqttv5.client.MqttActionListener;
import org.eclipse.paho.mqttv5.client.MqttAsyncClient;
import org.eclipse.paho.mqttv5.client.MqttCallback;
import org.eclipse.paho.mqttv5.client.MqttConnectionOptions;
import org.eclipse.paho.mqttv5.client.MqttDisconnectResponse;
import org.eclipse.paho.mqttv5.client.persist.MemoryPersistence;
import org.eclipse.paho.mqttv5.common.MqttException;
import org.eclipse.paho.mqttv5.common.MqttMessage;
import org.eclipse.paho.mqttv5.common.packet.MqttProperties;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 Eclipse Paho MQTT v5 的总线客户端
 *
 * 消息统一经 {@link MqttCallback#messageArrived} 按主题分发；未连接时登记的订阅在连接建立后生效，重连成功后自动恢复。
 * 发布不等待完成，避免在回调线程中阻塞，发布失败由监听器记录。
 */
@Slf4j
public class PahoV5ClientAdapter implements MqttClientAdapter {

    private final MqttConnectionConfig config;
    private final MqttAsyncClient client;
    private final MqttConnectionOptions options;
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    private record Subscription(int qos, IncomingMessageHandler handler) {
    }

    public PahoV5ClientAdapter(MqttConnectionConfig config) throws MqttException {
        this.config = config;
        this.options = new MqttConnectionOptions();
        options.setAutomaticReconnect(config.isAutomaticReconnect());
        options.setCleanStart(config.isCleanStart());
        options.setConnectionTimeout(config.getConnectionTimeoutSeconds());
        options.setKeepAliveInterval(config.getKeepAliveIntervalSeconds());
        if (config.getUsername() != null && !config.getUsername().isBlank()) {
            options.setUserName(config.getUsername());
        }
        if (config.getPassword() != null) {
            options.setPassword(config.getPassword().getBytes(StandardCharsets.UTF_8));
        }
        this.client = new MqttAsyncClient(config.getBrokerUrl(), config.getClientId(), new MemoryPersistence());
        this.client.setCallback(new DispatchingCallback());
    }

    @Override
    public void connect() throws Exception {
        client.connect(options).waitForCompletion(config.getConnectionTimeoutSeconds() * 1000L);
        if (!client.isConnected()) {
            throw new IllegalStateException("MQTT v5 client failed to connect: " + config.getBrokerUrl());
        }
        log.info("MQTT 已连接: {} (clientId={})", config.getBrokerUrl(), config.getClientId());
    }

    @Override
    public void disconnect() throws Exception {
        if (client.isConnected()) {
            client.disconnect().waitForCompletion(config.getCompletionTimeoutMillis());
        }
        client.close();
    }

    @Override
    public void publish(String topic, byte[] payload, int qos, boolean retained) throws Exception {
        MqttMessage message = new MqttMessage(payload != null ? payload : new byte[0]);
        message.setQos(qos);
        message.setRetained(retained);
        client.publish(topic, message, topic, new PublishFailureListener());
    }

    @Override
    public void subscribe(String topic, int qos, IncomingMessageHandler handler) throws Exception {
        subscriptions.put(topic, new Subscription(qos, handler));
        if (!client.isConnected()) {
            log.debug("尚未连接，连接建立后订阅: {}", topic);
            return;
        }
        client.subscribe(topic, qos).waitForCompletion(config.getCompletionTimeoutMillis());
        log.info("已订阅: {} (qos={})", topic, qos);
    }

    @Override
    public boolean reply(MqttMessageEnvelope request, byte[] payload) throws Exception {
        if (!request.expectsReply()) {
            return false;
        }
        MqttMessage message = new MqttMessage(payload != null ? payload : new byte[0]);
        message.setQos(config.getDefaultQos());
        if (request.getCorrelationData() != null) {
            MqttProperties properties = new MqttProperties();
            properties.setCorrelationData(request.getCorrelationData());
            message.setProperties(properties);
        }
        client.publish(request.getResponseTopic(), message, request.getResponseTopic(), new PublishFailureListener());
        return true;
    }

    @Override
    public boolean isConnected() {
        return client.isConnected();
    }

    private MqttMessageEnvelope toEnvelope(MqttMessage message) {
        MqttProperties properties = message.getProperties();
        String responseTopic = properties != null ? properties.getResponseTopic() : null;
        byte[] correlationData = properties != null ? properties.getCorrelationData() : null;
        return new MqttMessageEnvelope(message.getPayload(), message.getQos(), message.isRetained(),
                responseTopic, correlationData);
    }

    private class DispatchingCallback implements MqttCallback {

        @Override
        public void disconnected(MqttDisconnectResponse disconnectResponse) {
            log.warn("MQTT 连接断开: {}", disconnectResponse);
        }

        @Override
        public void mqttErrorOccurred(MqttException exception) {
            log.error("MQTT 客户端错误", exception);
        }

        @Override
        public void messageArrived(String topic, MqttMessage message) {
            Subscription subscription = subscriptions.get(topic);
            if (subscription == null) {
                log.debug("收到未订阅主题的消息，忽略: {}", topic);
                return;
            }
            try {
                subscription.handler().handle(topic, toEnvelope(message));
            } catch (RuntimeException e) {
                // 处理器异常不能抛回 Paho，否则连接会被断开
                log.error("消息处理异常: {}", topic, e);
            }
        }

        @Override
        public void deliveryComplete(IMqttToken token) {
        }

        @Override
        public void connectComplete(boolean reconnect, String serverURI) {
            // 首次连接前登记的订阅与断线前的订阅都在这里生效
            log.info("MQTT {}: {}，恢复 {} 个订阅", reconnect ? "重连成功" : "连接成功", serverURI, subscriptions.size());
            subscriptions.forEach((topic, subscription) -> {
                try {
                    client.subscribe(topic, subscription.qos());
                } catch (MqttException e) {
                    log.error("恢复订阅失败: {}", topic, e);
                }
            });
        }

        @Override
        public void authPacketArrived(int reasonCode, MqttProperties properties) {
        }
    }

    private static class PublishFailureListener implements MqttActionListener {

        @Override
        public void onSuccess(IMqttToken asyncActionToken) {
        }

        @Override
        public void onFailure(IMqttToken asyncActionToken, Throwable exception) {
            log.error("MQTT 发布失败: {}", asyncActionToken.getUserContext(), exception);
        }
    }
}
