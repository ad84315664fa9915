package com.caffe.emergency.model;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EscalationRule {
    private String id;
    private String name;

    @Builder.Default
    private List<AlertSeverity> severity = new ArrayList<>();

    @Builder.Default
    private List<String> categories = new ArrayList<>();

    private int timeThreshold;              // minutes

    @Builder.Default
    private List<String> escalateTo = new ArrayList<>();    // escalation contact groups

    @Builder.Default
    private List<NotificationChannel> channels = new ArrayList<>();

    private boolean enabled;
}
