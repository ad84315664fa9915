package com.caffe.emergency.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP feed for the coordination dashboard. Alert events are broadcast on
 * {@code /topic/emergency-alerts}; clients only subscribe, nothing is routed back to the app.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    static final String ENDPOINT = "/ws-emergency";
    static final String BROKER_PREFIX = "/topic";

    private final String[] allowedOrigins;

    public WebSocketConfig(@Value("${emergency.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker(BROKER_PREFIX);
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        // native STOMP clients connect to /ws-emergency/websocket
        registry.addEndpoint(ENDPOINT)
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();
    }
}
