package com.example.alerthistory.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertStatus {
    FIRING, RESOLVED;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertStatus fromValue(String value) {
        return value == null ? FIRING : AlertStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
