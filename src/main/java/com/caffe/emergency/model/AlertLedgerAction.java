package com.caffe.emergency.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Ledger actions recorded for emergency alerts, with the status each one produces.
 */
@Getter
@RequiredArgsConstructor
public enum AlertLedgerAction {
    CREATED("emergency_alert_created", AlertStatus.ACTIVE),
    ACKNOWLEDGED("emergency_alert_acknowledged", AlertStatus.ACKNOWLEDGED),
    ESCALATED("emergency_alert_escalated", AlertStatus.ESCALATED),
    RESOLVED("emergency_alert_resolved", AlertStatus.RESOLVED);

    public static final String ENTITY_TYPE = "emergency_alert";

    private final String wireName;
    private final AlertStatus resultingStatus;

    public static Optional<AlertLedgerAction> fromWireName(String wireName) {
        for (AlertLedgerAction action : values()) {
            if (action.wireName.equals(wireName)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
