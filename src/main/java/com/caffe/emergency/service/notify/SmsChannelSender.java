package com.caffe.emergency.service.notify;

import com.caffe.emergency.model.NotificationChannel;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SmsChannelSender implements ChannelSender {

    private final TwilioGateway twilioGateway;

    @Value("${twilio.phone-number:}")
    private String fromNumber;

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.SMS;
    }

    @Override
    public String send(String address, AlertMessage message) {
        return twilioGateway.sendMessage(fromNumber, address, "[CAFFE Alert] " + message.getText());
    }
}
