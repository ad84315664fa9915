package com.caffe.emergency.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum AlertSeverity {
    LOW("low", 60),
    MEDIUM("medium", 30),
    HIGH("high", 15),
    CRITICAL("critical", 5);

    private final String value;

    // Used only when no enabled escalation rule covers the severity
    private final int defaultEscalationMinutes;

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AlertSeverity fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (AlertSeverity severity : values()) {
            if (severity.value.equalsIgnoreCase(value.trim())) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
