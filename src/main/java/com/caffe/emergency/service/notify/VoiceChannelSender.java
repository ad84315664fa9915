package com.caffe.emergency.service.notify;

import com.caffe.emergency.model.NotificationChannel;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

@Component
@RequiredArgsConstructor
public class VoiceChannelSender implements ChannelSender {

    private final TwilioGateway twilioGateway;

    @Value("${twilio.phone-number:}")
    private String fromNumber;

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.VOICE;
    }

    @Override
    public String send(String address, AlertMessage message) {
        String spoken = HtmlUtils.htmlEscape(message.getText());
        // Said twice
        String twiml = "<Response><Say>" + spoken + "</Say><Pause length=\"1\"/><Say>" + spoken + "</Say></Response>";
        return twilioGateway.placeCall(fromNumber, address, twiml);
    }
}
