package com.caffe.emergency.service.notify;

import com.caffe.emergency.exception.DeliveryException;
import com.caffe.emergency.model.AlertSeverity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("TwilioGateway Tests")
class TwilioGatewayTest {

    private static final String BASE_URL = "https://api.twilio.test/2010-04-01";

    private MockRestServiceServer server;
    private TwilioGateway gateway;

    private final AlertMessage message = AlertMessage.builder()
            .kind(AlertMessage.Kind.ALERT)
            .alertId("alert_1")
            .severity(AlertSeverity.CRITICAL)
            .title("Shots fired")
            .subject("EMERGENCY ALERT: Shots fired")
            .text("EMERGENCY: Shots fired - Clarendon.")
            .build();

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        gateway = new TwilioGateway(restTemplate, new ObjectMapper());
        ReflectionTestUtils.setField(gateway, "baseUrl", BASE_URL);
        ReflectionTestUtils.setField(gateway, "accountSid", "AC123");
        ReflectionTestUtils.setField(gateway, "authToken", "secret");
    }

    @Test
    @DisplayName("sms is posted as a form with basic auth and returns the message sid")
    void smsSend() {
        server.expect(requestTo(BASE_URL + "/Accounts/AC123/Messages.json"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, startsWith("Basic ")))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
                .andExpect(content().string(containsString("CAFFE+Alert")))
                .andRespond(withSuccess("{\"sid\":\"SM42\",\"status\":\"queued\"}", MediaType.APPLICATION_JSON));

        SmsChannelSender sms = new SmsChannelSender(gateway);
        ReflectionTestUtils.setField(sms, "fromNumber", "+18765550000");

        assertThat(sms.send("+18765550101", message)).isEqualTo("SM42");
        server.verify();
    }

    @Test
    @DisplayName("whatsapp numbers carry the whatsapp prefix")
    void whatsappSend() {
        server.expect(requestTo(BASE_URL + "/Accounts/AC123/Messages.json"))
                .andExpect(content().string(containsString("To=whatsapp%3A%2B18765550101")))
                .andRespond(withSuccess("{\"sid\":\"SM43\"}", MediaType.APPLICATION_JSON));

        WhatsAppChannelSender whatsapp = new WhatsAppChannelSender(gateway);
        ReflectionTestUtils.setField(whatsapp, "fromNumber", "+18765550000");

        assertThat(whatsapp.send("+18765550101", message)).isEqualTo("SM43");
        server.verify();
    }

    @Test
    @DisplayName("provider error surfaces as a delivery exception")
    void providerError() {
        server.expect(requestTo(BASE_URL + "/Accounts/AC123/Calls.json"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> gateway.placeCall("+18765550000", "+18765550101", "<Response/>"))
                .isInstanceOf(DeliveryException.class);
    }

    @Test
    @DisplayName("missing credentials fail without calling the provider")
    void notConfigured() {
        ReflectionTestUtils.setField(gateway, "authToken", "");

        assertThat(gateway.isConfigured()).isFalse();
        assertThatThrownBy(() -> gateway.sendMessage("+1", "+2", "body")).isInstanceOf(DeliveryException.class);
        server.verify();
    }
}
