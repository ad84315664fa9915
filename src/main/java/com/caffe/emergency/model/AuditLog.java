package com.caffe.emergency.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Append-only audit row. Emergency alert history is stored here and replayed on startup.
 */
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_logs_entity", columnList = "entity_type, entity_id"),
        @Index(name = "idx_audit_logs_action", columnList = "action")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id")
    private String userId;              // null for system-fired transitions

    @Column(nullable = false)
    private String action;              // emergency_alert_created / ..._acknowledged / ...

    @Column(name = "entity_type", nullable = false)
    private String entityType;

    @Column(name = "entity_id")
    private String entityId;

    @Column(name = "new_values", columnDefinition = "TEXT")
    private String newValues;           // JSON snapshot after the transition

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
