package com.caffe.emergency.service.ledger;

import com.caffe.emergency.exception.PersistenceException;
import com.caffe.emergency.model.AuditLog;
import com.caffe.emergency.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link Ledger} over the {@code audit_logs} table. Only inserts are ever issued.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaLedger implements Ledger {

    private final AuditLogRepository auditLogRepository;

    @Override
    @Transactional
    public LedgerRecord append(LedgerRecord record) {
        AuditLog row = AuditLog.builder()
                .userId(record.getActorId())
                .action(record.getAction())
                .entityType(record.getEntityType())
                .entityId(record.getEntityId())
                .newValues(record.getPayload())
                .createdAt(record.getTimestamp())
                .build();
        try {
            AuditLog saved = auditLogRepository.saveAndFlush(row);
            return record.toBuilder().sequence(saved.getId()).build();
        } catch (DataAccessException e) {
            throw new PersistenceException(record.getAction() + " for " + record.getEntityId(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerRecord> query(LedgerQuery query) {
        try {
            List<AuditLog> rows;
            if (query.getEntityId() != null) {
                rows = auditLogRepository.findByEntityTypeAndEntityIdOrderByCreatedAtAscIdAsc(
                        query.getEntityType(), query.getEntityId());
            } else if (query.getAction() != null) {
                rows = auditLogRepository.findByEntityTypeAndActionOrderByCreatedAtAscIdAsc(
                        query.getEntityType(), query.getAction());
            } else {
                rows = auditLogRepository.findByEntityTypeOrderByCreatedAtAscIdAsc(query.getEntityType());
            }
            return rows.stream()
                    .map(this::toRecord)
                    .filter(query::matches)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw new PersistenceException("query " + query, e);
        }
    }

    private LedgerRecord toRecord(AuditLog row) {
        return LedgerRecord.builder()
                .sequence(row.getId())
                .action(row.getAction())
                .entityType(row.getEntityType())
                .entityId(row.getEntityId())
                .actorId(row.getUserId())
                .timestamp(row.getCreatedAt())
                .payload(row.getNewValues())
                .build();
    }
}
