package com.example.alerthistory.suppression;

import com.example.alerthistory.error.AlertHistoryException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of a silence query. {@code error} is set only when the query failed open.
 */
public record SilenceVerdict(boolean silenced, List<String> silenceIds, @JsonIgnore AlertHistoryException error) {

    public SilenceVerdict {
        silenceIds = silenceIds == null ? List.of() : List.copyOf(silenceIds);
    }

    public static SilenceVerdict notSilenced() {
        return new SilenceVerdict(false, List.of(), null);
    }

    public static SilenceVerdict silenced(List<String> silenceIds) {
        return new SilenceVerdict(true, silenceIds, null);
    }

    public static SilenceVerdict failedOpen(AlertHistoryException error) {
        return new SilenceVerdict(false, List.of(), error);
    }

    @JsonProperty("errorCode")
    public String errorCode() {
        return error == null ? null : error.getCode();
    }

    public boolean hasError() {
        return error != null;
    }
}
