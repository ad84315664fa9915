package com.caffe.emergency.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle of an emergency alert.
 *
 * <pre>
 * active ──► acknowledged ──► resolved
 *   │              ▲              ▲
 *   └──► escalated ┘──────────────┘
 * </pre>
 *
 * {@code resolved} is terminal; every non-resolved state may be resolved.
 */
@RequiredArgsConstructor
public enum AlertStatus {
    ACTIVE("active"),
    ACKNOWLEDGED("acknowledged"),
    ESCALATED("escalated"),
    RESOLVED("resolved");

    private final String value;

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean canTransitionTo(AlertStatus target) {
        switch (this) {
            case ACTIVE:
                return target == ACKNOWLEDGED || target == ESCALATED || target == RESOLVED;
            case ESCALATED:
                return target == ACKNOWLEDGED || target == RESOLVED;
            case ACKNOWLEDGED:
                return target == RESOLVED;
            default:
                return false;
        }
    }

    public boolean isOpen() {
        return this != RESOLVED;
    }

    @JsonCreator
    public static AlertStatus fromValue(String value) {
        for (AlertStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown alert status: " + value);
    }
}
