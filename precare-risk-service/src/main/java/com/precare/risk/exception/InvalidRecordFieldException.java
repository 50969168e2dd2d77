package com.precare.risk.exception;

import lombok.Getter;

/**
 * A patient record reached the engine with a missing or out-of-range field.
 */
@Getter
public class InvalidRecordFieldException extends RuntimeException {

    private final String field;

    public InvalidRecordFieldException(String field, String reason) {
        super("Invalid record field '" + field + "': " + reason);
        this.field = field;
    }
}
