package com.caffe.emergency.service.notify;

import com.caffe.emergency.exception.DeliveryException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Minimal client for the Twilio Messages and Calls REST resources.
 */
@Component
@Slf4j
public class TwilioGateway {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${twilio.base-url:https://api.twilio.com/2010-04-01}")
    private String baseUrl;

    @Value("${twilio.account-sid:}")
    private String accountSid;

    @Value("${twilio.auth-token:}")
    private String authToken;

    public TwilioGateway(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    public boolean isConfigured() {
        return !accountSid.isBlank() && !authToken.isBlank();
    }

    /**
     * @return message SID
     */
    public String sendMessage(String from, String to, String body) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("From", from);
        form.add("To", to);
        form.add("Body", body);
        return post("/Messages.json", form);
    }

    /**
     * @return call SID
     */
    public String placeCall(String from, String to, String twiml) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("From", from);
        form.add("To", to);
        form.add("Twiml", twiml);
        return post("/Calls.json", form);
    }

    private String post(String resource, MultiValueMap<String, String> form) {
        if (!isConfigured()) {
            throw new DeliveryException("Twilio credentials not configured");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setBasicAuth(accountSid, authToken);

        String url = baseUrl + "/Accounts/" + accountSid + resource;
        try {
            String response = restTemplate.postForObject(url, new HttpEntity<>(form, headers), String.class);
            if (response == null || response.isEmpty()) {
                throw new DeliveryException("Empty response from Twilio " + resource);
            }
            JsonNode json = objectMapper.readTree(response);
            return json.path("sid").asText(null);
        } catch (RestClientException e) {
            throw new DeliveryException("Twilio " + resource + " request failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new DeliveryException("Unreadable Twilio response: " + e.getMessage(), e);
        }
    }
}
