package com.caffe.emergency.exception;

/**
 * The ledger rejected an append or query. A transition that raised this was not applied.
 */
public class PersistenceException extends BaseException {
    public PersistenceException(String detail, Throwable cause) {
        super(EmergencyErrorCode.LEDGER_FAILURE, cause, detail);
    }
}
