package com.wangbin.edge.core.bus;

/**
 * 消息总线客户端抽象，屏蔽具体 MQTT 客户端实现
 */
public interface MqttClientAdapter extends AutoCloseable {

    void connect() throws Exception;

    void disconnect() throws Exception;

    void publish(String topic, byte[] payload, int qos, boolean retained) throws Exception;

    /**
     * 订阅主题，同一主题重复订阅时替换处理器。
     * 未连接时只登记，连接建立（含重连）后生效。
     */
    void subscribe(String topic, int qos, IncomingMessageHandler handler) throws Exception;

    /**
     * 按请求携带的响应主题与关联数据回复；请求未携带响应主题时返回false
     */
    boolean reply(MqttMessageEnvelope request, byte[] payload) throws Exception;

    boolean isConnected();

    @Override
    default void close() throws Exception {
        disconnect();
    }
}
