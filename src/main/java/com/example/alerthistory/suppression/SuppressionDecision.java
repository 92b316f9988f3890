package com.example.alerthistory.suppression;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Combined answer for one alert: suppressed if silenced or inhibited.
 */
public record SuppressionDecision(String fingerprint, SilenceVerdict silence, InhibitionVerdict inhibition) {

    @JsonProperty("suppressed")
    public boolean isSuppressed() {
        return silence.silenced() || inhibition.inhibited();
    }

    /** True when either query failed open, so the alert may be shown although it would be suppressed */
    @JsonProperty("degraded")
    public boolean isDegraded() {
        return silence.hasError() || inhibition.hasError();
    }
}
