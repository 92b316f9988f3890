package com.example.alerthistory.silencing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Locale;

public enum SilenceStatus {
    PENDING, ACTIVE, EXPIRED;

    /**
     * pending while now &lt; startsAt, active while startsAt &lt;= now &lt; endsAt, expired from endsAt on.
     */
    public static SilenceStatus of(Instant startsAt, Instant endsAt, Instant now) {
        if (now.isBefore(startsAt)) {
            return PENDING;
        }
        if (now.isBefore(endsAt)) {
            return ACTIVE;
        }
        return EXPIRED;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SilenceStatus fromValue(String value) {
        return SilenceStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
