package com.caffe.emergency.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;
import java.util.function.Function;

/**
 * Delivery channels. Each channel knows which recipient identifier it addresses,
 * so adding a channel means adding a constant here plus one {@code ChannelSender}.
 */
public enum NotificationChannel {
    SMS("sms", Recipient::getPhone),
    EMAIL("email", Recipient::getEmail),
    PUSH("push", Recipient::getDeviceId),
    WHATSAPP("whatsapp", Recipient::getPhone),
    VOICE("voice", Recipient::getPhone);

    private final String value;
    private final Function<Recipient, String> identifier;

    NotificationChannel(String value, Function<Recipient, String> identifier) {
        this.value = value;
        this.identifier = identifier;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Channel-specific address of the recipient, empty when the recipient has none.
     */
    public Optional<String> addressOf(Recipient recipient) {
        String address = identifier.apply(recipient);
        if (address == null || address.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(address.trim());
    }

    @JsonCreator
    public static NotificationChannel fromValue(String value) {
        for (NotificationChannel channel : values()) {
            if (channel.value.equalsIgnoreCase(value)) {
                return channel;
            }
        }
        // "call" is the legacy name of the voice channel
        if ("call".equalsIgnoreCase(value)) {
            return VOICE;
        }
        throw new IllegalArgumentException("Unknown notification channel: " + value);
    }
}
