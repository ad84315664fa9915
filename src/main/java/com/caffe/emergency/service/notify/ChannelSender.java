package com.caffe.emergency.service.notify;

import com.caffe.emergency.exception.DeliveryException;
import com.caffe.emergency.model.NotificationChannel;

/**
 * Transport for a single channel.
 */
public interface ChannelSender {

    NotificationChannel channel();

    /**
     * @return provider message id
     * @throws DeliveryException if the provider rejected or could not be reached
     */
    String send(String address, AlertMessage message);
}
