package com.caffe.emergency.dto;

import com.caffe.emergency.model.Alert;
import lombok.*;

import java.time.Instant;

/**
 * Live-feed message pushed to dashboard subscribers after each applied transition.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertEventDTO {
    private String type;        // created / acknowledged / escalated / resolved
    private Alert alert;
    private Instant timestamp;
}
