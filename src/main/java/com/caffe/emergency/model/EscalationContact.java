package com.caffe.emergency.model;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Higher-authority contact notified when an alert escalates.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EscalationContact {
    private String name;
    private String email;
    private String phone;
    private String deviceId;

    @Builder.Default
    private List<String> groups = new ArrayList<>();

    public Recipient toRecipient() {
        return Recipient.builder()
                .id("escalation:" + name)
                .name(name)
                .email(email)
                .phone(phone)
                .deviceId(deviceId)
                .build();
    }
}
