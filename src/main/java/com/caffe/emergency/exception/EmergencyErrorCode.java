package com.caffe.emergency.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum EmergencyErrorCode implements ErrorCode {
    // === Client Errors (4xx) ===
    INVALID_ALERT_INPUT("E001", "Invalid alert input: %s", HttpStatus.BAD_REQUEST),
    ALERT_NOT_FOUND("E002", "Alert not found (id: %s)", HttpStatus.NOT_FOUND),
    INVALID_ALERT_STATE("E003", "Cannot %s alert %s while it is %s", HttpStatus.CONFLICT),

    // === Server Errors (5xx) ===
    LEDGER_FAILURE("S001", "Alert ledger operation failed: %s", HttpStatus.INTERNAL_SERVER_ERROR),
    DELIVERY_FAILURE("S002", "Notification delivery failed: %s", HttpStatus.BAD_GATEWAY),
    INTERNAL_SERVER_ERROR("S999", "Internal server error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String message;
    private final HttpStatus status;
}
