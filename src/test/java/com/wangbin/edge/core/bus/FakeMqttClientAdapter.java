package com.wangbin.edge.core.bus;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 内存版总线客户端，记录发布与订阅，可模拟连接或发布失败
 */
public class FakeMqttClientAdapter implements MqttClientAdapter {

    public record Published(String topic, byte[] payload, int qos, boolean retained, byte[] correlationData) {
    }

    private final Map<String, IncomingMessageHandler> subscriptions = new ConcurrentHashMap<>();
    private final List<Published> published = new CopyOnWriteArrayList<>();
    private volatile boolean connected;
    private volatile boolean failConnect;
    private volatile boolean failPublish;
    private final AtomicInteger remainingConnectFailures = new AtomicInteger();
    private final AtomicInteger connectAttempts = new AtomicInteger();

    public void setFailConnect(boolean failConnect) {
        this.failConnect = failConnect;
    }

    /**
     * 接下来的 count 次连接失败，之后恢复正常
     */
    public void failNextConnects(int count) {
        remainingConnectFailures.set(count);
    }

    public int getConnectAttempts() {
        return connectAttempts.get();
    }

    public void setFailPublish(boolean failPublish) {
        this.failPublish = failPublish;
    }

    public List<Published> getPublished() {
        return published;
    }

    public Map<String, IncomingMessageHandler> getSubscriptions() {
        return subscriptions;
    }

    /**
     * 模拟收到一条消息
     */
    public void deliver(String topic, MqttMessageEnvelope envelope) {
        if (!connected) {
            throw new IllegalStateException("not connected");
        }
        IncomingMessageHandler handler = subscriptions.get(topic);
        if (handler == null) {
            throw new IllegalStateException("no subscription for " + topic);
        }
        handler.handle(topic, envelope);
    }

    @Override
    public void connect() throws Exception {
        connectAttempts.incrementAndGet();
        if (failConnect || remainingConnectFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IllegalStateException("broker unreachable");
        }
        connected = true;
    }

    @Override
    public void disconnect() {
        connected = false;
    }

    @Override
    public void publish(String topic, byte[] payload, int qos, boolean retained) throws Exception {
        if (failPublish) {
            throw new IllegalStateException("publish failed");
        }
        published.add(new Published(topic, payload, qos, retained, null));
    }

    @Override
    public void subscribe(String topic, int qos, IncomingMessageHandler handler) {
        subscriptions.put(topic, handler);
    }

    @Override
    public boolean reply(MqttMessageEnvelope request, byte[] payload) throws Exception {
        if (!request.expectsReply()) {
            return false;
        }
        published.add(new Published(request.getResponseTopic(), payload, 1, false, request.getCorrelationData()));
        return true;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }
}
