package com.caffe.emergency.service.notify;

import com.caffe.emergency.model.NotificationChannel;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WhatsAppChannelSender implements ChannelSender {

    private static final String PREFIX = "whatsapp:";

    private final TwilioGateway twilioGateway;

    @Value("${twilio.whatsapp-number:}")
    private String fromNumber;

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.WHATSAPP;
    }

    @Override
    public String send(String address, AlertMessage message) {
        return twilioGateway.sendMessage(PREFIX + fromNumber, PREFIX + address, message.getText());
    }
}
