package com.caffe.emergency.repository;

import com.caffe.emergency.model.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    List<AuditLog> findByEntityTypeOrderByCreatedAtAscIdAsc(String entityType);

    List<AuditLog> findByEntityTypeAndActionOrderByCreatedAtAscIdAsc(String entityType, String action);

    List<AuditLog> findByEntityTypeAndEntityIdOrderByCreatedAtAscIdAsc(String entityType, String entityId);
}
