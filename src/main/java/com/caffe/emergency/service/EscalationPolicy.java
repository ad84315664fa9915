package com.caffe.emergency.service;

import com.caffe.emergency.config.EmergencyProperties;
import com.caffe.emergency.model.*;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Severity-driven escalation table: deadline, escalation channels and escalation contacts.
 */
@Component
@RequiredArgsConstructor
public class EscalationPolicy {

    private static final List<NotificationChannel> DEFAULT_ESCALATION_CHANNELS = List.of(NotificationChannel.EMAIL);

    private final EmergencyProperties properties;

    public Optional<EscalationRule> ruleFor(AlertSeverity severity) {
        return properties.getEscalationRules().stream()
                .filter(EscalationRule::isEnabled)
                .filter(rule -> rule.getSeverity().contains(severity))
                .findFirst();
    }

    public Duration delayFor(AlertSeverity severity) {
        int minutes = ruleFor(severity)
                .map(EscalationRule::getTimeThreshold)
                .orElse(severity.getDefaultEscalationMinutes());
        return Duration.ofMinutes(minutes);
    }

    public List<NotificationChannel> escalationChannels(AlertSeverity severity) {
        return ruleFor(severity)
                .map(EscalationRule::getChannels)
                .filter(channels -> !channels.isEmpty())
                .orElse(DEFAULT_ESCALATION_CHANNELS);
    }

    /**
     * Contacts whose groups match the rule's {@code escalateTo}; every contact when none match.
     */
    public List<Recipient> escalationRecipients(AlertSeverity severity) {
        List<EscalationContact> contacts = properties.getEscalationContacts();
        List<String> targets = ruleFor(severity).map(EscalationRule::getEscalateTo).orElse(List.of());

        List<EscalationContact> matched = contacts.stream()
                .filter(contact -> contact.getGroups().stream().anyMatch(targets::contains))
                .collect(Collectors.toList());

        return (matched.isEmpty() ? contacts : matched).stream()
                .map(EscalationContact::toRecipient)
                .collect(Collectors.toList());
    }

    public List<EscalationRule> listRules() {
        return List.copyOf(properties.getEscalationRules());
    }
}
