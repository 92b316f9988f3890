package com.example.alerthistory.suppression;

import com.example.alerthistory.domain.Alert;
import com.example.alerthistory.error.AlertHistoryException;
import com.example.alerthistory.inhibition.InhibitionRule;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of an inhibition query: the inhibiting source alert and the rule that matched.
 * {@code error} is set only when the query failed open.
 */
public record InhibitionVerdict(boolean inhibited,
                                Alert sourceAlert,
                                @JsonIgnore InhibitionRule rule,
                                @JsonIgnore AlertHistoryException error) {

    public static InhibitionVerdict notInhibited() {
        return new InhibitionVerdict(false, null, null, null);
    }

    public static InhibitionVerdict inhibitedBy(Alert source, InhibitionRule rule) {
        return new InhibitionVerdict(true, source, rule, null);
    }

    public static InhibitionVerdict failedOpen(AlertHistoryException error) {
        return new InhibitionVerdict(false, null, null, error);
    }

    @JsonProperty("ruleName")
    public String ruleName() {
        return rule == null ? null : rule.getName();
    }

    @JsonProperty("errorCode")
    public String errorCode() {
        return error == null ? null : error.getCode();
    }

    public boolean hasError() {
        return error != null;
    }
}
