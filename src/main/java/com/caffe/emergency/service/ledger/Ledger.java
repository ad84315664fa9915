package com.caffe.emergency.service.ledger;

import com.caffe.emergency.exception.PersistenceException;

import java.util.List;

/**
 * Append-only, timestamped record store. The only persistence of the alert engine.
 */
public interface Ledger {

    /**
     * Appends a record and returns it with its assigned sequence.
     *
     * @throws PersistenceException if the record could not be stored
     */
    LedgerRecord append(LedgerRecord record);

    /**
     * Records matching the query, oldest first (timestamp, then sequence).
     *
     * @throws PersistenceException if the store cannot be read
     */
    List<LedgerRecord> query(LedgerQuery query);

    /**
     * Full history of one entity, oldest first.
     */
    default List<LedgerRecord> history(String entityType, String entityId) {
        return query(LedgerQuery.forEntityType(entityType).withEntityId(entityId));
    }
}
