package com.conflictdata.exception;

/**
 * Requested country, region or record has no matching rows.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
