package com.caffe.emergency.service.notify;

import com.caffe.emergency.exception.DeliveryException;
import com.caffe.emergency.model.AlertSeverity;
import com.caffe.emergency.model.NotificationChannel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

@DisplayName("ChannelRoutingNotifier Tests")
class ChannelRoutingNotifierTest {

    private static final AlertMessage MESSAGE = AlertMessage.builder()
            .kind(AlertMessage.Kind.ALERT)
            .alertId("alert_1")
            .severity(AlertSeverity.HIGH)
            .title("Generator failure")
            .subject("EMERGENCY ALERT: Generator failure")
            .text("EMERGENCY: Generator failure - Manchester.")
            .html("<h2>Generator failure</h2>")
            .build();

    private static ChannelSender sender(NotificationChannel channel) {
        ChannelSender sender = mock(ChannelSender.class);
        given(sender.channel()).willReturn(channel);
        return sender;
    }

    @Test
    @DisplayName("delivery is routed to the sender of the channel")
    void routesByChannel() {
        ChannelSender sms = sender(NotificationChannel.SMS);
        ChannelSender email = sender(NotificationChannel.EMAIL);
        given(email.send(eq("ops@example.com"), any())).willReturn("<msg-1@example.com>");
        ChannelRoutingNotifier notifier = new ChannelRoutingNotifier(List.of(sms, email));

        DeliveryResult result = notifier.sendChannel(NotificationChannel.EMAIL, "ops@example.com", MESSAGE);

        assertThat(result.isDelivered()).isTrue();
        assertThat(result.getProviderMessageId()).isEqualTo("<msg-1@example.com>");
    }

    @Test
    @DisplayName("provider failure becomes a failed result")
    void providerFailure() {
        ChannelSender sms = sender(NotificationChannel.SMS);
        given(sms.send(any(), any())).willThrow(new DeliveryException("Twilio /Messages.json request failed"));
        ChannelRoutingNotifier notifier = new ChannelRoutingNotifier(List.of(sms));

        DeliveryResult result = notifier.sendChannel(NotificationChannel.SMS, "+18765550101", MESSAGE);

        assertThat(result.isDelivered()).isFalse();
        assertThat(result.getError()).contains("Twilio");
    }

    @Test
    @DisplayName("channel without sender fails the delivery")
    void missingSender() {
        ChannelRoutingNotifier notifier = new ChannelRoutingNotifier(List.of(sender(NotificationChannel.SMS)));

        DeliveryResult result = notifier.sendChannel(NotificationChannel.PUSH, "device-1", MESSAGE);

        assertThat(result.isDelivered()).isFalse();
        assertThat(result.getError()).contains("push");
    }

    @Test
    @DisplayName("two senders for one channel are rejected")
    void duplicateSender() {
        List<ChannelSender> senders = List.of(sender(NotificationChannel.SMS), sender(NotificationChannel.SMS));

        assertThatThrownBy(() -> new ChannelRoutingNotifier(senders)).isInstanceOf(IllegalStateException.class);
    }
}
