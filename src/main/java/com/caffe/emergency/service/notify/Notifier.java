package com.caffe.emergency.service.notify;

import com.caffe.emergency.model.NotificationChannel;

/**
 * Delivery capability used by the dispatcher. Every call is independent; a failure is
 * reported in the result rather than thrown.
 */
public interface Notifier {

    DeliveryResult sendChannel(NotificationChannel channel, String address, AlertMessage message);
}
