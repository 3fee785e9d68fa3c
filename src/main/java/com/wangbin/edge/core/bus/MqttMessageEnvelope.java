package com.wangbin.edge.core.bus;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 收到的一条消息；responseTopic / correlationData 来自 MQTT v5 请求-应答属性，可为空
 */
@Getter
@RequiredArgsConstructor
public class MqttMessageEnvelope {
    private final byte[] payload;
    private final int qos;
    private final boolean retained;
    private final String responseTopic;
    private final byte[] correlationData;

    public boolean expectsReply() {
        return responseTopic != null && !responseTopic.isBlank();
    }
}
