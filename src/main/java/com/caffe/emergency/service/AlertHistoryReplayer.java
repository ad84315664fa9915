package com.caffe.emergency.service;

import com.caffe.emergency.model.Alert;
import com.caffe.emergency.model.AlertLedgerAction;
import com.caffe.emergency.model.AlertStatus;
import com.caffe.emergency.service.ledger.Ledger;
import com.caffe.emergency.service.ledger.LedgerQuery;
import com.caffe.emergency.service.ledger.LedgerRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Rebuilds alert state from the ledger. For each alert id the creation record is the
 * starting point and every later transition record is applied in (timestamp, sequence)
 * order. Records that are unreadable, precede the creation record, or describe a
 * transition that is illegal from the replayed state (duplicates) are skipped, so the
 * latest legal record wins.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertHistoryReplayer {

    private static final Comparator<LedgerRecord> LEDGER_ORDER = Comparator
            .comparing(LedgerRecord::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(LedgerRecord::getSequence, Comparator.nullsLast(Comparator.naturalOrder()));

    private final Ledger ledger;
    private final AlertSnapshotCodec codec;

    /**
     * Current state of every alert ever created, resolved ones included.
     */
    public List<Alert> replayAll() {
        List<LedgerRecord> records = ledger.query(LedgerQuery.forEntityType(AlertLedgerAction.ENTITY_TYPE));

        Map<String, List<LedgerRecord>> byAlert = new LinkedHashMap<>();
        for (LedgerRecord record : records) {
            if (record.getEntityId() == null) {
                log.warn("Skipping ledger record {} without entity id", record.getSequence());
                continue;
            }
            byAlert.computeIfAbsent(record.getEntityId(), id -> new ArrayList<>()).add(record);
        }

        List<Alert> alerts = new ArrayList<>();
        byAlert.forEach((id, history) -> fold(id, history).ifPresent(alerts::add));
        return alerts;
    }

    public Optional<Alert> replay(String alertId) {
        return fold(alertId, ledger.history(AlertLedgerAction.ENTITY_TYPE, alertId));
    }

    Optional<Alert> fold(String alertId, List<LedgerRecord> history) {
        List<LedgerRecord> ordered = history.stream().sorted(LEDGER_ORDER).collect(Collectors.toList());

        Alert state = null;
        for (LedgerRecord record : ordered) {
            Optional<AlertLedgerAction> action = AlertLedgerAction.fromWireName(record.getAction());
            if (action.isEmpty()) {
                continue;
            }
            Optional<Alert> snapshot = codec.read(record.getPayload());
            if (snapshot.isEmpty()) {
                log.warn("⚠️ Skipping malformed {} record {} for alert {}", record.getAction(), record.getSequence(), alertId);
                continue;
            }

            if (action.get() == AlertLedgerAction.CREATED) {
                if (state == null) {
                    state = created(alertId, snapshot.get(), record).orElse(null);
                } else {
                    log.debug("Ignoring duplicate creation record {} for alert {}", record.getSequence(), alertId);
                }
            } else if (state == null) {
                log.warn("⚠️ Skipping {} record {} for alert {}: no creation record precedes it",
                        record.getAction(), record.getSequence(), alertId);
            } else {
                state = apply(state, action.get(), snapshot.get(), record);
            }
        }

        if (state == null && !ordered.isEmpty()) {
            log.warn("⚠️ Alert {} has {} ledger record(s) but no readable creation record", alertId, ordered.size());
        }
        return Optional.ofNullable(state);
    }

    /**
     * Initial state from a creation snapshot, or empty when the snapshot lacks severity,
     * parish or any creation time.
     */
    private Optional<Alert> created(String alertId, Alert snapshot, LedgerRecord record) {
        Instant createdAt = firstNonNull(snapshot.getCreatedAt(), record.getTimestamp());
        if (snapshot.getSeverity() == null || snapshot.getParish() == null || snapshot.getParish().isBlank()
                || createdAt == null) {
            log.warn("⚠️ Skipping incomplete creation record {} for alert {}: severity, parish or creation time missing",
                    record.getSequence(), alertId);
            return Optional.empty();
        }
        return Optional.of(snapshot.toBuilder()
                .id(alertId)
                .status(AlertStatus.ACTIVE)
                .createdAt(createdAt)
                .build());
    }

    private Alert apply(Alert state, AlertLedgerAction action, Alert snapshot, LedgerRecord record) {
        AlertStatus target = action.getResultingStatus();
        if (!state.getStatus().canTransitionTo(target)) {
            log.debug("Ignoring {} record {} for alert {} in status {}",
                    record.getAction(), record.getSequence(), state.getId(), state.getStatus());
            return state;
        }

        Alert.AlertBuilder next = state.toBuilder().status(target);
        switch (action) {
            case ACKNOWLEDGED:
                next.acknowledgedBy(firstNonNull(snapshot.getAcknowledgedBy(), record.getActorId()))
                        .acknowledgedAt(firstNonNull(snapshot.getAcknowledgedAt(), record.getTimestamp()));
                break;
            case ESCALATED:
                next.escalatedAt(firstNonNull(snapshot.getEscalatedAt(), record.getTimestamp()));
                break;
            case RESOLVED:
                next.resolvedBy(firstNonNull(snapshot.getResolvedBy(), record.getActorId()))
                        .resolvedAt(firstNonNull(snapshot.getResolvedAt(), record.getTimestamp()))
                        .resolution(snapshot.getResolution());
                break;
            default:
                break;
        }
        return next.build();
    }

    private static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
