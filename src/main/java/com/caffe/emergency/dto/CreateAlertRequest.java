package com.caffe.emergency.dto;

import com.caffe.emergency.model.AlertSeverity;
import com.caffe.emergency.model.NotificationChannel;
import com.caffe.emergency.model.Recipient;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateAlertRequest {
    private String title;
    private String description;
    private AlertSeverity severity;
    private String category;

    // Location
    private String parish;
    private String pollingStation;
    private Double latitude;
    private Double longitude;

    private List<NotificationChannel> channels;
    private List<Recipient> recipients;
    private String createdBy;
}
