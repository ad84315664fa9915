package com.caffe.emergency.dto;

import lombok.*;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertStatisticsDTO {
    private long activeAlerts;
    private long totalAlerts;
    private long recentAlerts;          // created within the statistics window
    private double avgResponseTime;     // minutes from creation to acknowledgement
    private long totalRecipients;       // distinct recipients reached
    private long deliveryAttempts;
    private double successRate;         // percent of delivery attempts that succeeded
    private Map<String, Long> severityBreakdown;
}
