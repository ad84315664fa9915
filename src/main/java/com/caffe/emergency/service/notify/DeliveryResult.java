package com.caffe.emergency.service.notify;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class DeliveryResult {
    private final boolean delivered;
    private final String providerMessageId;
    private final String error;

    private DeliveryResult(boolean delivered, String providerMessageId, String error) {
        this.delivered = delivered;
        this.providerMessageId = providerMessageId;
        this.error = error;
    }

    public static DeliveryResult delivered(String providerMessageId) {
        return new DeliveryResult(true, providerMessageId, null);
    }

    public static DeliveryResult failed(String error) {
        return new DeliveryResult(false, null, error);
    }
}
