package com.caffe.emergency.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChannelConfig {
    private String id;
    private String name;
    private NotificationChannel channel;
    private boolean enabled;
    private int priority;                   // 1 = dispatched first
    private boolean parishScoped;           // dynamic recipients narrowed to the alert's parish
    private NotificationChannel fallback;   // tried when this channel fails or is disabled
}
