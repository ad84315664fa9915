package com.caffe.emergency.service;

import com.caffe.emergency.config.EmergencyProperties;
import com.caffe.emergency.dto.AlertStatisticsDTO;
import com.caffe.emergency.dto.CreateAlertRequest;
import com.caffe.emergency.dto.SystemTestResultDTO;
import com.caffe.emergency.exception.AlertNotFoundException;
import com.caffe.emergency.exception.InvalidAlertStateException;
import com.caffe.emergency.exception.PersistenceException;
import com.caffe.emergency.exception.ValidationException;
import com.caffe.emergency.model.*;
import com.caffe.emergency.service.ledger.Ledger;
import com.caffe.emergency.service.ledger.LedgerRecord;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Emergency alert lifecycle: create, acknowledge, resolve and severity-driven escalation.
 *
 * <p>Every transition of an alert runs under that alert's lock and follows the same
 * order: check the current state, append one ledger record, then update the in-memory
 * store and the escalation timer. A failed append leaves both untouched. Notification
 * fan-out and the dashboard broadcast are started afterwards and never block or fail
 * the transition.
 *
 * <p>Invariant: an alert has a live escalation timer if and only if its status is
 * {@code active}.
 */
@Service
@Slf4j
public class EmergencyAlertEngine {

    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final String SYSTEM_TEST_RESOLUTION = "System test completed successfully";

    private final Ledger ledger;
    private final AlertSnapshotCodec codec;
    private final AlertHistoryReplayer replayer;
    private final NotificationDispatcher dispatcher;
    private final EscalationPolicy escalationPolicy;
    private final ChannelRegistry channelRegistry;
    private final DeliveryStatistics deliveryStatistics;
    private final AlertEventPublisher eventPublisher;
    private final EmergencyProperties properties;
    private final Clock clock;

    private final AlertStore alertStore;
    private final EscalationScheduler escalationScheduler;
    private final AlertLockRegistry locks;
    private final SecureRandom random = new SecureRandom();

    public EmergencyAlertEngine(Ledger ledger,
                                AlertSnapshotCodec codec,
                                AlertHistoryReplayer replayer,
                                NotificationDispatcher dispatcher,
                                EscalationPolicy escalationPolicy,
                                ChannelRegistry channelRegistry,
                                DeliveryStatistics deliveryStatistics,
                                AlertEventPublisher eventPublisher,
                                EmergencyProperties properties,
                                Clock clock,
                                @Qualifier("escalationTaskScheduler") TaskScheduler taskScheduler) {
        this.ledger = ledger;
        this.codec = codec;
        this.replayer = replayer;
        this.dispatcher = dispatcher;
        this.escalationPolicy = escalationPolicy;
        this.channelRegistry = channelRegistry;
        this.deliveryStatistics = deliveryStatistics;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
        this.alertStore = new AlertStore(replayer);
        this.escalationScheduler = new EscalationScheduler(taskScheduler, clock);
        this.locks = new AlertLockRegistry(properties.getLockStripes());
    }

    /**
     * Rebuilds the open-alert index from the ledger and re-arms the timers of active
     * alerts with what is left of their original deadline.
     */
    @PostConstruct
    public void start() {
        escalationScheduler.cancelAll();
        List<Alert> open = alertStore.rebuild();
        Instant now = clock.instant();

        int armed = 0;
        for (Alert alert : open) {
            if (alert.getStatus() != AlertStatus.ACTIVE) {
                continue;
            }
            Duration elapsed = Duration.between(alert.getCreatedAt(), now);
            Duration remaining = escalationPolicy.delayFor(alert.getSeverity()).minus(elapsed);
            if (remaining.isNegative()) {
                remaining = Duration.ZERO;
            }
            armEscalation(alert.getId(), remaining);
            armed++;
        }
        log.info("✅ Emergency alert engine started: {} open alert(s), {} escalation timer(s) re-armed", open.size(), armed);
    }

    @PreDestroy
    public void stop() {
        escalationScheduler.cancelAll();
    }

    // ===== Transitions =====

    public Alert createAlert(CreateAlertRequest input) {
        Alert alert = newAlert(input);

        locks.withLock(alert.getId(), () -> {
            persist(AlertLedgerAction.CREATED, alert, alert.getCreatedBy(), alert.getCreatedAt());
            alertStore.put(alert);
            armEscalation(alert.getId(), escalationPolicy.delayFor(alert.getSeverity()));
            return alert;
        });

        log.info("🚨 Alert {} created: [{}] {} in {}", alert.getId(), alert.getSeverity().getValue(),
                alert.getTitle(), alert.getParish());
        startFanOut(alert, () -> dispatcher.dispatch(alert));
        eventPublisher.publish("created", alert);
        return alert;
    }

    public Alert acknowledgeAlert(String alertId, String actorId) {
        Alert acknowledged = locks.withLock(alertId, () -> {
            Alert current = openAlert(alertId, "acknowledge");
            if (current.getStatus() != AlertStatus.ACTIVE && current.getStatus() != AlertStatus.ESCALATED) {
                throw new InvalidAlertStateException("acknowledge", alertId, current.getStatus());
            }
            Instant now = clock.instant();
            Alert next = current.toBuilder()
                    .status(AlertStatus.ACKNOWLEDGED)
                    .acknowledgedBy(actorId)
                    .acknowledgedAt(now)
                    .build();

            persist(AlertLedgerAction.ACKNOWLEDGED, next, actorId, now);
            alertStore.put(next);
            escalationScheduler.cancel(alertId);
            return next;
        });

        log.info("✅ Alert {} acknowledged by {}", alertId, actorId);
        eventPublisher.publish("acknowledged", acknowledged);
        return acknowledged;
    }

    public Alert resolveAlert(String alertId, String actorId, String resolution) {
        Alert resolved = locks.withLock(alertId, () -> {
            Alert current = openAlert(alertId, "resolve");
            Instant now = clock.instant();
            Alert next = current.toBuilder()
                    .status(AlertStatus.RESOLVED)
                    .resolvedBy(actorId)
                    .resolvedAt(now)
                    .resolution(resolution)
                    .build();

            persist(AlertLedgerAction.RESOLVED, next, actorId, now);
            alertStore.remove(alertId);
            escalationScheduler.cancel(alertId);
            return next;
        });

        log.info("✅ Alert {} resolved by {}", alertId, actorId);
        eventPublisher.publish("resolved", resolved);
        return resolved;
    }

    /**
     * Manual escalation by a coordinator. Only an active alert can be escalated.
     */
    public Alert escalateAlert(String alertId, String actorId) {
        Alert escalated = locks.withLock(alertId, () -> {
            Alert current = openAlert(alertId, "escalate");
            if (current.getStatus() != AlertStatus.ACTIVE) {
                throw new InvalidAlertStateException("escalate", alertId, current.getStatus());
            }
            return escalate(current, actorId);
        });
        afterEscalation(escalated);
        return escalated;
    }

    /**
     * Timer callback. Re-reads the alert under its lock; if it is no longer active the
     * timer lost a race with acknowledge/resolve and nothing happens.
     */
    void onEscalationDue(String alertId) {
        Alert escalated = locks.withLock(alertId, () -> {
            Alert current = alertStore.get(alertId).orElse(null);
            if (current == null || current.getStatus() != AlertStatus.ACTIVE) {
                log.debug("Escalation timer for alert {} fired after it left active, ignoring", alertId);
                return null;
            }
            try {
                return escalate(current, null);
            } catch (PersistenceException e) {
                Duration retry = properties.getEscalationRetryDelay();
                log.error("❌ Could not record escalation of alert {}, retrying in {}", alertId, retry, e);
                armEscalation(alertId, retry);
                return null;
            }
        });
        if (escalated != null) {
            afterEscalation(escalated);
        }
    }

    private Alert escalate(Alert current, String actorId) {
        Instant now = clock.instant();
        Alert next = current.toBuilder()
                .status(AlertStatus.ESCALATED)
                .escalatedAt(now)
                .build();

        persist(AlertLedgerAction.ESCALATED, next, actorId, now);
        alertStore.put(next);
        escalationScheduler.cancel(current.getId());
        return next;
    }

    private void afterEscalation(Alert escalated) {
        log.warn("🔺 Alert {} escalated ({}), notifying escalation contacts", escalated.getId(),
                escalated.getSeverity().getValue());
        startFanOut(escalated, () -> dispatcher.dispatchEscalation(escalated));
        eventPublisher.publish("escalated", escalated);
    }

    private void startFanOut(Alert alert, Runnable fanOut) {
        try {
            fanOut.run();
        } catch (RuntimeException e) {
            log.error("❌ Notification fan-out for alert {} could not be started", alert.getId(), e);
        }
    }

    // ===== Queries =====

    public Alert getAlert(String alertId) {
        return alertStore.get(alertId)
                .or(() -> replayer.replay(alertId))
                .orElseThrow(() -> new AlertNotFoundException(alertId));
    }

    public List<Alert> listActiveAlerts() {
        return alertStore.list();
    }

    /**
     * Every alert ever created, replayed from the ledger, newest first.
     */
    public List<Alert> listAllAlerts() {
        return replayer.replayAll().stream()
                .sorted(Comparator.comparing(Alert::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .collect(Collectors.toList());
    }

    public AlertStatisticsDTO getStatistics() {
        return getStatistics(properties.getStatisticsWindow());
    }

    public AlertStatisticsDTO getStatistics(Duration window) {
        List<Alert> all = replayer.replayAll();
        Instant windowStart = clock.instant().minus(window);

        long recent = all.stream()
                .filter(alert -> alert.getCreatedAt() != null && alert.getCreatedAt().isAfter(windowStart))
                .count();

        double avgResponseTime = all.stream()
                .filter(alert -> alert.getCreatedAt() != null && alert.getAcknowledgedAt() != null)
                .mapToDouble(alert -> Duration.between(alert.getCreatedAt(), alert.getAcknowledgedAt()).getSeconds() / 60.0)
                .average()
                .orElse(0);

        Map<String, Long> severityBreakdown = new LinkedHashMap<>();
        for (AlertSeverity severity : List.of(AlertSeverity.CRITICAL, AlertSeverity.HIGH, AlertSeverity.MEDIUM, AlertSeverity.LOW)) {
            severityBreakdown.put(severity.getValue(), all.stream().filter(alert -> alert.getSeverity() == severity).count());
        }

        return AlertStatisticsDTO.builder()
                .activeAlerts(alertStore.size())
                .totalAlerts(all.size())
                .recentAlerts(recent)
                .avgResponseTime(Math.round(avgResponseTime * 10) / 10.0)
                .totalRecipients(deliveryStatistics.getReachedRecipients())
                .deliveryAttempts(deliveryStatistics.getAttempts())
                .successRate(deliveryStatistics.getSuccessRate())
                .severityBreakdown(severityBreakdown)
                .build();
    }

    public List<ChannelConfig> listChannels() {
        return channelRegistry.listChannels();
    }

    public List<EscalationRule> listEscalationRules() {
        return escalationPolicy.listRules();
    }

    /**
     * Creates a low-severity test alert and resolves it straight away.
     */
    public SystemTestResultDTO testEmergencySystem(String actorId) {
        try {
            Alert testAlert = createAlert(CreateAlertRequest.builder()
                    .title("System Test Alert")
                    .description("This is a test of the emergency alert system. No action required.")
                    .severity(AlertSeverity.LOW)
                    .category("system_test")
                    .parish("Kingston")
                    .channels(List.of(NotificationChannel.EMAIL))
                    .createdBy(actorId)
                    .build());
            resolveAlert(testAlert.getId(), actorId, SYSTEM_TEST_RESOLUTION);
            return new SystemTestResultDTO(true, "Emergency system test completed successfully");
        } catch (RuntimeException e) {
            log.error("❌ Emergency system test failed", e);
            return new SystemTestResultDTO(false, "Emergency system test failed: " + e.getMessage());
        }
    }

    // ===== Visible for tests =====

    boolean isEscalationArmed(String alertId) {
        return escalationScheduler.isArmed(alertId);
    }

    Optional<Instant> escalationFireTime(String alertId) {
        return escalationScheduler.fireTime(alertId);
    }

    int armedEscalationCount() {
        return escalationScheduler.armedCount();
    }

    // ===== Helpers =====

    private Alert newAlert(CreateAlertRequest input) {
        if (input == null) {
            throw new ValidationException("alert input is required");
        }
        if (input.getSeverity() == null) {
            throw new ValidationException("severity is required");
        }
        if (input.getParish() == null || input.getParish().isBlank()) {
            throw new ValidationException("location.parish is required");
        }

        Set<NotificationChannel> channels = input.getChannels() == null || input.getChannels().isEmpty()
                ? channelRegistry.enabledChannels()
                : EnumSet.copyOf(input.getChannels());

        AlertLocation.Coordinates coordinates = input.getLatitude() != null && input.getLongitude() != null
                ? new AlertLocation.Coordinates(input.getLatitude(), input.getLongitude())
                : null;

        Instant now = clock.instant();
        return Alert.builder()
                .id(newAlertId(now))
                .title(input.getTitle())
                .description(input.getDescription())
                .category(input.getCategory())
                .severity(input.getSeverity())
                .location(AlertLocation.builder()
                        .parish(input.getParish().trim())
                        .pollingStation(input.getPollingStation())
                        .coordinates(coordinates)
                        .build())
                .status(AlertStatus.ACTIVE)
                .channels(Collections.unmodifiableSet(channels))
                .recipients(input.getRecipients() == null ? List.of() : List.copyOf(input.getRecipients()))
                .createdBy(input.getCreatedBy())
                .createdAt(now)
                .build();
    }

    private String newAlertId(Instant now) {
        StringBuilder suffix = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "alert_" + now.toEpochMilli() + "_" + suffix;
    }

    /**
     * The open alert, or the reason it cannot be transitioned: resolved alerts are an
     * invalid state, unknown ids are not found.
     */
    private Alert openAlert(String alertId, String operation) {
        Optional<Alert> open = alertStore.get(alertId);
        if (open.isPresent()) {
            return open.get();
        }
        Optional<Alert> historical = replayer.replay(alertId);
        if (historical.isPresent() && historical.get().getStatus() == AlertStatus.RESOLVED) {
            throw new InvalidAlertStateException(operation, alertId, AlertStatus.RESOLVED);
        }
        throw new AlertNotFoundException(alertId);
    }

    private void persist(AlertLedgerAction action, Alert snapshot, String actorId, Instant timestamp) {
        ledger.append(LedgerRecord.builder()
                .action(action.getWireName())
                .entityType(AlertLedgerAction.ENTITY_TYPE)
                .entityId(snapshot.getId())
                .actorId(actorId)
                .timestamp(timestamp)
                .payload(codec.write(snapshot))
                .build());
    }

    private void armEscalation(String alertId, Duration delay) {
        escalationScheduler.arm(alertId, delay, () -> onEscalationDue(alertId));
    }
}
