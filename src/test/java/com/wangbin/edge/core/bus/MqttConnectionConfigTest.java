package com.wangbin.edge.core.bus;

import com.wangbin.edge.core.config.EdgeProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MqttConnectionConfigTest {

    @Test
    void defaultsFromProperties() {
        MqttConnectionConfig config = MqttConnectionConfig.from(new EdgeProperties().getMqtt());

        assertEquals("tcp://localhost:1883", config.getBrokerUrl());
        assertTrue(config.getClientId().startsWith("edge-core-"));
        assertEquals("edge-core-".length() + 8, config.getClientId().length());
        assertEquals(1, config.getDefaultQos());
        assertTrue(config.isCleanStart());
        assertTrue(config.isAutomaticReconnect());
        assertEquals(5000L, config.getCompletionTimeoutMillis());
    }

    @Test
    void explicitClientIdAndClampedQos() {
        EdgeProperties.MqttConfig mqtt = new EdgeProperties.MqttConfig();
        mqtt.setClientId("gateway-1");
        mqtt.setQos(5);

        MqttConnectionConfig config = MqttConnectionConfig.from(mqtt);

        assertEquals("gateway-1", config.getClientId());
        assertEquals(2, config.getDefaultQos());
    }
}
