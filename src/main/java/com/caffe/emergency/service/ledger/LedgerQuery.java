package com.caffe.emergency.service.ledger;

import lombok.Getter;
import lombok.ToString;

/**
 * Filter for {@link Ledger#query}. {@code entityType} is required, the other fields narrow it.
 */
@Getter
@ToString
public class LedgerQuery {
    private final String entityType;
    private final String action;
    private final String entityId;

    private LedgerQuery(String entityType, String action, String entityId) {
        this.entityType = entityType;
        this.action = action;
        this.entityId = entityId;
    }

    public static LedgerQuery forEntityType(String entityType) {
        return new LedgerQuery(entityType, null, null);
    }

    public LedgerQuery withAction(String action) {
        return new LedgerQuery(entityType, action, entityId);
    }

    public LedgerQuery withEntityId(String entityId) {
        return new LedgerQuery(entityType, action, entityId);
    }

    public boolean matches(LedgerRecord record) {
        return entityType.equals(record.getEntityType())
                && (action == null || action.equals(record.getAction()))
                && (entityId == null || entityId.equals(record.getEntityId()));
    }
}
