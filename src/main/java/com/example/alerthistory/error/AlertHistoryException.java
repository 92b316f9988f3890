package com.example.alerthistory.error;

/**
 * Base type of every error raised by the suppression engine.
 */
public abstract class AlertHistoryException extends RuntimeException {

    protected AlertHistoryException(String message) {
        super(message);
    }

    protected AlertHistoryException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Short machine-readable code used by the REST layer and metrics */
    public abstract String getCode();
}
