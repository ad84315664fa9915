package com.caffe.emergency.service.notify;

import com.caffe.emergency.exception.DeliveryException;
import com.caffe.emergency.model.NotificationChannel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.*;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Push notifications for the observer mobile app: one MQTT topic per device.
 */
@Component
@Slf4j
public class PushChannelSender implements ChannelSender {

    private final ObjectMapper objectMapper;

    @Value("${mqtt.broker.url:}")
    private String brokerUrl;

    @Value("${mqtt.username:}")
    private String username;

    @Value("${mqtt.password:}")
    private String password;

    @Value("${mqtt.client.id:emergency-alert-publisher}")
    private String clientId;

    @Value("${mqtt.push.topic-prefix:caffe/devices}")
    private String topicPrefix;

    private MqttClient mqttClient;

    public PushChannelSender(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        if (brokerUrl.isBlank()) {
            log.warn("MQTT broker not configured, push notifications disabled");
            return;
        }
        try {
            mqttClient = new MqttClient(brokerUrl, clientId, new MemoryPersistence());

            MqttConnectOptions options = new MqttConnectOptions();
            if (!username.isBlank()) {
                options.setUserName(username);
                options.setPassword(password.toCharArray());
            }
            options.setCleanSession(true);
            options.setAutomaticReconnect(true);
            options.setConnectionTimeout(10);
            options.setKeepAliveInterval(60);

            mqttClient.connect(options);
            log.info("✅ Connected to MQTT broker for push: {}", brokerUrl);
        } catch (MqttException e) {
            log.error("❌ Failed to connect to MQTT broker {}", brokerUrl, e);
        }
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.PUSH;
    }

    @Override
    public String send(String address, AlertMessage message) {
        if (mqttClient == null || !mqttClient.isConnected()) {
            throw new DeliveryException("MQTT broker not connected");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alertId", message.getAlertId());
        payload.put("kind", message.getKind().name().toLowerCase());
        payload.put("severity", message.getSeverity().getValue());
        payload.put("title", message.getSubject());
        payload.put("body", message.getText());

        try {
            MqttMessage mqttMessage = new MqttMessage(objectMapper.writeValueAsString(payload)
                    .getBytes(StandardCharsets.UTF_8));
            mqttMessage.setQos(1);

            String topic = topicPrefix + "/" + address;
            mqttClient.publish(topic, mqttMessage);
            return topic;
        } catch (JsonProcessingException | MqttException e) {
            throw new DeliveryException("push to device " + address + ": " + e.getMessage(), e);
        }
    }

    @PreDestroy
    public void cleanup() {
        try {
            if (mqttClient != null && mqttClient.isConnected()) {
                mqttClient.disconnect();
                mqttClient.close();
                log.info("MQTT push publisher disconnected");
            }
        } catch (MqttException e) {
            log.error("Error disconnecting MQTT push publisher", e);
        }
    }
}
