package com.caffe.emergency.service;

import com.caffe.emergency.dto.AlertEventDTO;
import com.caffe.emergency.model.Alert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Pushes applied transitions to dashboard subscribers over STOMP.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertEventPublisher {

    static final String DESTINATION = "/topic/emergency-alerts";

    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    public void publish(String type, Alert alert) {
        AlertEventDTO event = AlertEventDTO.builder()
                .type(type)
                .alert(alert)
                .timestamp(clock.instant())
                .build();
        try {
            messagingTemplate.convertAndSend(DESTINATION, event);
        } catch (MessagingException e) {
            log.warn("Could not broadcast {} event for alert {}: {}", type, alert.getId(), e.getMessage());
        }
    }
}
