package com.example.alerthistory.error;

import lombok.Getter;

import java.time.Duration;

@Getter
public class SuppressionTimeoutException extends AlertHistoryException {

    private final String operation;
    private final Duration budget;

    public SuppressionTimeoutException(String operation, Duration budget) {
        super("Deadline exceeded during " + operation + " (budget " + budget.toMillis() + "ms)");
        this.operation = operation;
        this.budget = budget;
    }

    @Override
    public String getCode() {
        return "timeout";
    }
}
