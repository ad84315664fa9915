package com.caffe.emergency.config;

import com.caffe.emergency.model.*;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Emergency alert configuration ({@code emergency.*}).
 *
 * <ul>
 *   <li>channels: notification channel table, dispatch priority and fallback links
 *   <li>escalation-rules: severity to escalation deadline, contact groups and channels
 *   <li>escalation-contacts: fixed higher-authority recipients of escalation fan-out
 *   <li>dynamic-roles: roles targeted when an alert carries no explicit recipients
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "emergency")
public class EmergencyProperties {

    private List<ChannelConfig> channels = defaultChannels();

    private List<EscalationRule> escalationRules = defaultEscalationRules();

    private List<EscalationContact> escalationContacts = new ArrayList<>();

    private Set<UserRole> dynamicRoles = EnumSet.of(UserRole.ADMIN, UserRole.COORDINATOR, UserRole.SUPERVISOR);

    /** Window for the "recent alerts" statistic. */
    private Duration statisticsWindow = Duration.ofHours(24);

    /** Delay before a timer-fired escalation is retried after a ledger failure. */
    private Duration escalationRetryDelay = Duration.ofMinutes(1);

    /** Number of per-alert lock stripes serializing transitions. */
    private int lockStripes = 64;

    private Dispatcher dispatcher = new Dispatcher();

    @Data
    public static class Dispatcher {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 1000;
    }

    public static List<ChannelConfig> defaultChannels() {
        List<ChannelConfig> channels = new ArrayList<>();
        channels.add(new ChannelConfig("sms", "SMS Messages", NotificationChannel.SMS, true, 1, true, NotificationChannel.EMAIL));
        channels.add(new ChannelConfig("email", "Email Notifications", NotificationChannel.EMAIL, true, 2, false, null));
        channels.add(new ChannelConfig("push", "Push Notifications", NotificationChannel.PUSH, true, 3, false, null));
        channels.add(new ChannelConfig("whatsapp", "WhatsApp Messages", NotificationChannel.WHATSAPP, false, 4, true, NotificationChannel.SMS));
        channels.add(new ChannelConfig("voice", "Voice Calls", NotificationChannel.VOICE, false, 5, true, NotificationChannel.SMS));
        return channels;
    }

    public static List<EscalationRule> defaultEscalationRules() {
        List<EscalationRule> rules = new ArrayList<>();
        rules.add(EscalationRule.builder()
                .id("critical_immediate").name("Critical Alert Escalation")
                .severity(new ArrayList<>(List.of(AlertSeverity.CRITICAL)))
                .categories(new ArrayList<>(List.of("security_threat", "violence", "medical_emergency")))
                .timeThreshold(5)
                .escalateTo(new ArrayList<>(List.of("emergency_coordinator", "election_commission")))
                .channels(new ArrayList<>(List.of(NotificationChannel.SMS, NotificationChannel.VOICE)))
                .enabled(true)
                .build());
        rules.add(EscalationRule.builder()
                .id("high_priority").name("High Priority Escalation")
                .severity(new ArrayList<>(List.of(AlertSeverity.HIGH)))
                .categories(new ArrayList<>(List.of("equipment_failure", "crowd_control")))
                .timeThreshold(15)
                .escalateTo(new ArrayList<>(List.of("field_supervisor")))
                .channels(new ArrayList<>(List.of(NotificationChannel.SMS, NotificationChannel.EMAIL)))
                .enabled(true)
                .build());
        rules.add(EscalationRule.builder()
                .id("standard_escalation").name("Standard Escalation")
                .severity(new ArrayList<>(List.of(AlertSeverity.MEDIUM)))
                .categories(new ArrayList<>(List.of("other")))
                .timeThreshold(30)
                .escalateTo(new ArrayList<>(List.of("coordinator")))
                .channels(new ArrayList<>(List.of(NotificationChannel.EMAIL)))
                .enabled(true)
                .build());
        rules.add(EscalationRule.builder()
                .id("low_priority").name("Low Priority Escalation")
                .severity(new ArrayList<>(List.of(AlertSeverity.LOW)))
                .categories(new ArrayList<>(List.of("other")))
                .timeThreshold(60)
                .escalateTo(new ArrayList<>(List.of("coordinator")))
                .channels(new ArrayList<>(List.of(NotificationChannel.EMAIL)))
                .enabled(true)
                .build());
        return rules;
    }
}
