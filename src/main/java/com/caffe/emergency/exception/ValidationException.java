package com.caffe.emergency.exception;

public class ValidationException extends BaseException {
    public ValidationException(String detail) {
        super(EmergencyErrorCode.INVALID_ALERT_INPUT, detail);
    }
}
