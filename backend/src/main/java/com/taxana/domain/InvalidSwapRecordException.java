package com.taxana.domain;

import lombok.Getter;

/**
 * Thrown when a swap record breaks an input invariant (missing field, negative amount).
 * The whole calculation run is aborted; FIFO results are meaningless with a negative-amount lot.
 */
@Getter
public class InvalidSwapRecordException extends RuntimeException {

    public static final String NULL_RECORD = "NULL_RECORD";
    public static final String MISSING_SIGNATURE = "MISSING_SIGNATURE";
    public static final String MISSING_TIMESTAMP = "MISSING_TIMESTAMP";
    public static final String MISSING_TOKEN = "MISSING_TOKEN";
    public static final String INVALID_AMOUNT = "INVALID_AMOUNT";

    /** Signature of the offending record; null when the signature itself is missing. */
    private final String signature;
    private final String reason;

    public InvalidSwapRecordException(String signature, String reason, String message) {
        super(message);
        this.signature = signature;
        this.reason = reason;
    }
}
