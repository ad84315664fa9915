package com.caffe.emergency.exception;

import com.caffe.emergency.model.AlertStatus;
import lombok.Getter;

@Getter
public class InvalidAlertStateException extends BaseException {
    private final AlertStatus currentStatus;

    public InvalidAlertStateException(String operation, String alertId, AlertStatus currentStatus) {
        super(EmergencyErrorCode.INVALID_ALERT_STATE, operation, alertId, currentStatus.getValue());
        this.currentStatus = currentStatus;
    }
}
