package com.caffe.emergency.service.notify;

import com.caffe.emergency.exception.DeliveryException;
import com.caffe.emergency.model.NotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes each delivery to the {@link ChannelSender} registered for its channel.
 */
@Service
@Slf4j
public class ChannelRoutingNotifier implements Notifier {

    private final Map<NotificationChannel, ChannelSender> senders = new EnumMap<>(NotificationChannel.class);

    public ChannelRoutingNotifier(List<ChannelSender> channelSenders) {
        for (ChannelSender sender : channelSenders) {
            ChannelSender previous = senders.put(sender.channel(), sender);
            if (previous != null) {
                throw new IllegalStateException("Two senders registered for channel " + sender.channel()
                        + ": " + previous.getClass().getSimpleName() + ", " + sender.getClass().getSimpleName());
            }
        }
        log.info("✅ Notification senders registered for channels: {}", senders.keySet());
    }

    @Override
    public DeliveryResult sendChannel(NotificationChannel channel, String address, AlertMessage message) {
        ChannelSender sender = senders.get(channel);
        if (sender == null) {
            return DeliveryResult.failed("No sender registered for channel " + channel.getValue());
        }
        try {
            String providerId = sender.send(address, message);
            log.debug("📨 {} delivered to {} for alert {}", channel.getValue(), address, message.getAlertId());
            return DeliveryResult.delivered(providerId);
        } catch (DeliveryException e) {
            return DeliveryResult.failed(e.getMessage());
        }
    }
}
