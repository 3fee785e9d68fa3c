package com.wangbin.edge.core.bus;

@FunctionalInterface
public interface IncomingMessageHandler {
    void handle(String topic, MqttMessageEnvelope envelope);
}
