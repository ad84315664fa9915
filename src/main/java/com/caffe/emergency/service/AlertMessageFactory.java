package com.caffe.emergency.service;

import com.caffe.emergency.model.Alert;
import com.caffe.emergency.service.notify.AlertMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

@Component
public class AlertMessageFactory {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("dd MMM yyyy, HH:mm");

    private final ZoneId zone;

    public AlertMessageFactory(@Value("${app.timezone:America/Jamaica}") String timezone) {
        this.zone = ZoneId.of(timezone);
    }

    public AlertMessage alertMessage(Alert alert) {
        String html = "<h2>Emergency Alert - " + severity(alert) + "</h2>"
                + "<p><strong>Location:</strong> " + escape(alert.getLocation().describe()) + "</p>"
                + "<p><strong>Category:</strong> " + escape(alert.getCategory()) + "</p>"
                + "<p><strong>Description:</strong> " + escape(alert.getDescription()) + "</p>"
                + "<p><strong>Time:</strong> " + formatTime(alert) + "</p>"
                + "<p>Please respond immediately to acknowledge this alert.</p>";

        return AlertMessage.builder()
                .kind(AlertMessage.Kind.ALERT)
                .alertId(alert.getId())
                .severity(alert.getSeverity())
                .title(alert.getTitle())
                .subject("EMERGENCY ALERT: " + alert.getTitle())
                .text("EMERGENCY: " + alert.getTitle() + " - " + alert.getParish() + ". " + nullToEmpty(alert.getDescription()))
                .html(html)
                .build();
    }

    public AlertMessage escalationMessage(Alert alert) {
        String html = "<h2>Escalated Emergency Alert - " + severity(alert) + "</h2>"
                + "<p><strong>Alert ID:</strong> " + escape(alert.getId()) + "</p>"
                + "<p><strong>Location:</strong> " + escape(alert.getLocation().describe()) + "</p>"
                + "<p><strong>Description:</strong> " + escape(alert.getDescription()) + "</p>"
                + "<p><strong>Created:</strong> " + formatTime(alert) + "</p>"
                + "<p style=\"color: red;\"><strong>This alert has been escalated due to lack of acknowledgment.</strong></p>";

        return AlertMessage.builder()
                .kind(AlertMessage.Kind.ESCALATION)
                .alertId(alert.getId())
                .severity(alert.getSeverity())
                .title(alert.getTitle())
                .subject("ESCALATED ALERT: " + alert.getTitle())
                .text("ESCALATED: " + alert.getTitle() + " - " + alert.getParish()
                        + ". Not acknowledged since " + formatTime(alert) + ". Alert " + alert.getId())
                .html(html)
                .build();
    }

    private String severity(Alert alert) {
        return alert.getSeverity().getValue().toUpperCase();
    }

    private String formatTime(Alert alert) {
        return alert.getCreatedAt().atZone(zone).format(TIME_FORMAT);
    }

    private static String escape(String value) {
        return HtmlUtils.htmlEscape(nullToEmpty(value));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
