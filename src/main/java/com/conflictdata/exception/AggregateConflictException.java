package com.conflictdata.exception;

/**
 * Another request inserted the risk aggregate for the same country first.
 * Caught by the read path, which re-reads the winning row.
 */
public class AggregateConflictException extends RuntimeException {

    public AggregateConflictException(String country, Throwable cause) {
        super("Risk aggregate already exists for country: " + country, cause);
    }
}
