package com.civicdesk.backend.modules.authorization.infrastructure;

/**
 * The permission cache backend could not be reached or returned unreadable data.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
