package com.caffe.emergency.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * An emergency alert and its lifecycle fields. Instances held by the engine are
 * never mutated in place: every transition builds a new copy with {@link #toBuilder()}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Alert {

    private String id;
    private String title;
    private String description;
    private String category;
    private AlertSeverity severity;
    private AlertLocation location;
    private AlertStatus status;

    private Set<NotificationChannel> channels;
    private List<Recipient> recipients;     // empty = resolve by role/parish at dispatch time

    private String createdBy;
    private Instant createdAt;

    private String acknowledgedBy;
    private Instant acknowledgedAt;

    private Instant escalatedAt;

    private String resolvedBy;
    private Instant resolvedAt;
    private String resolution;

    @JsonIgnore
    public boolean hasExplicitRecipients() {
        return recipients != null && !recipients.isEmpty();
    }

    @JsonIgnore
    public String getParish() {
        return location != null ? location.getParish() : null;
    }
}
