package com.jay.alm.exception;

/**
 * Base class for failures that abort an engine run.
 * Business findings (discrepancies, ambiguous groups) are returned as data, not thrown.
 */
public class AlmException extends RuntimeException {

    public AlmException(String message) {
        super(message);
    }

    public AlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
