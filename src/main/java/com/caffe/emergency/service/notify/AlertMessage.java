package com.caffe.emergency.service.notify;

import com.caffe.emergency.model.AlertSeverity;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Rendered notification content for one alert, shared by every channel.
 */
@Getter
@Builder
@ToString
public class AlertMessage {

    public enum Kind { ALERT, ESCALATION }

    private final Kind kind;
    private final String alertId;
    private final AlertSeverity severity;
    private final String title;
    private final String subject;
    private final String text;      // sms / whatsapp / voice / push
    private final String html;      // email
}
