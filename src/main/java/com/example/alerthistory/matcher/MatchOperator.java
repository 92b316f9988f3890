package com.example.alerthistory.matcher;

import com.example.alerthistory.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Label comparison operators, in Prometheus/Alertmanager notation.
 */
public enum MatchOperator {
    EQUAL("="),
    NOT_EQUAL("!="),
    REGEX("=~"),
    NOT_REGEX("!~");

    private final String symbol;

    MatchOperator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    public boolean isRegex() {
        return this == REGEX || this == NOT_REGEX;
    }

    @JsonCreator
    public static MatchOperator fromSymbol(String symbol) {
        if (symbol != null) {
            for (MatchOperator op : values()) {
                if (op.symbol.equals(symbol) || op.name().equalsIgnoreCase(symbol)) {
                    return op;
                }
            }
        }
        throw new ValidationException("matchers.operator", "valid_operator",
                "Unknown matcher operator: " + symbol + " (expected =, !=, =~ or !~)");
    }
}
