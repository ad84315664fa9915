package com.caffe.emergency.service.ledger;

import lombok.*;

import java.time.Instant;

/**
 * One immutable ledger entry. {@code sequence} is assigned by the ledger on append
 * and breaks timestamp ties during replay.
 */
@Getter
@ToString
@Builder(toBuilder = true)
@AllArgsConstructor
public class LedgerRecord {
    private final Long sequence;
    private final String action;
    private final String entityType;
    private final String entityId;
    private final String actorId;
    private final Instant timestamp;
    private final String payload;
}
