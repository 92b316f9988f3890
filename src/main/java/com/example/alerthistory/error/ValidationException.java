package com.example.alerthistory.error;

import lombok.Getter;

/**
 * Caller misuse: names the offending field and the constraint it violated.
 */
@Getter
public class ValidationException extends AlertHistoryException {

    private final String field;
    private final String constraint;

    public ValidationException(String field, String constraint, String message) {
        super(message);
        this.field = field;
        this.constraint = constraint;
    }

    public ValidationException(String field, String constraint, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
        this.constraint = constraint;
    }

    @Override
    public String getCode() {
        return "validation_error";
    }
}
