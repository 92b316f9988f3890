package com.example.alerthistory.error;

/**
 * The underlying state store (silences, firing alerts, inhibition state) failed or is unavailable.
 */
public class StateStoreException extends AlertHistoryException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "state_store_error";
    }
}
