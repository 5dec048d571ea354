package com.incidentsentinel.core.spi;

/**
 * Thrown when an {@link IncidentStore} fails to append or read incidents.
 */
public class IncidentStoreException extends Exception {

    private static final long serialVersionUID = 1L;

    public IncidentStoreException(String message) {
        super(message);
    }

    public IncidentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
