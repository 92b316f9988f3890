package com.example.alerthistory.error;

public class ConflictException extends AlertHistoryException {

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "conflict";
    }
}
