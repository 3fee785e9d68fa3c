package com.wangbin.edge.core.bus;

import com.wangbin.edge.common.utils.IdGenerator;
import com.wangbin.edge.core.config.EdgeProperties;
import lombok.Getter;

@Getter
public class MqttConnectionConfig {

    private final String brokerUrl;
    private final String clientId;
    private final String username;
    private final String password;
    private final boolean cleanStart;
    private final int connectionTimeoutSeconds;
    private final int keepAliveIntervalSeconds;
    private final boolean automaticReconnect;
    private final int defaultQos;
    private final long completionTimeoutMillis;

    private MqttConnectionConfig(String brokerUrl,
                                 String clientId,
                                 String username,
                                 String password,
                                 boolean cleanStart,
                                 int connectionTimeoutSeconds,
                                 int keepAliveIntervalSeconds,
                                 boolean automaticReconnect,
                                 int defaultQos,
                                 long completionTimeoutMillis) {
        this.brokerUrl = brokerUrl;
        this.clientId = clientId;
        this.username = username;
        this.password = password;
        this.cleanStart = cleanStart;
        this.connectionTimeoutSeconds = connectionTimeoutSeconds;
        this.keepAliveIntervalSeconds = keepAliveIntervalSeconds;
        this.automaticReconnect = automaticReconnect;
        this.defaultQos = defaultQos;
        this.completionTimeoutMillis = completionTimeoutMillis;
    }

    public static MqttConnectionConfig from(EdgeProperties.MqttConfig mqtt) {
        String clientId = mqtt.getClientId();
        if (clientId == null || clientId.isBlank()) {
            clientId = "edge-core-" + IdGenerator.generateUuid().substring(0, 8);
        }
        int qos = Math.max(0, Math.min(2, mqtt.getQos()));
        return new MqttConnectionConfig(mqtt.getBrokerUrl(), clientId, mqtt.getUsername(), mqtt.getPassword(),
                mqtt.isCleanStart(), mqtt.getConnectionTimeout(), mqtt.getKeepAliveInterval(),
                mqtt.isAutomaticReconnect(), qos, mqtt.getCompletionTimeout());
    }
}
