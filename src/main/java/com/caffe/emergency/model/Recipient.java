package com.caffe.emergency.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Recipient {
    private String id;
    private String name;
    private String phone;       // sms / whatsapp / voice
    private String email;
    private String deviceId;    // push
}
