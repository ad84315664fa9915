package com.caffe.emergency.exception;

public class AlertNotFoundException extends BaseException {
    public AlertNotFoundException(String alertId) {
        super(EmergencyErrorCode.ALERT_NOT_FOUND, alertId);
    }
}
