package com.caffe.emergency.exception;

/**
 * A single channel/recipient delivery failed. Never escapes notification fan-out.
 */
public class DeliveryException extends BaseException {
    public DeliveryException(String detail) {
        super(EmergencyErrorCode.DELIVERY_FAILURE, detail);
    }

    public DeliveryException(String detail, Throwable cause) {
        super(EmergencyErrorCode.DELIVERY_FAILURE, cause, detail);
    }
}
