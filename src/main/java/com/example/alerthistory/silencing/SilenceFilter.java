package com.example.alerthistory.silencing;

import com.example.alerthistory.error.ValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Criteria for listing silences. Status is matched against the time window at query time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SilenceFilter {

    @Builder.Default
    private Set<SilenceStatus> statuses = EnumSet.noneOf(SilenceStatus.class);
    private String createdBy;
    private String matcherName;
    private String matcherValue;
    private Instant startsAfter;
    private Instant startsBefore;
    private Instant endsAfter;
    private Instant endsBefore;

    @Builder.Default
    private int page = 0;
    /** 0 means the configured default page size */
    @Builder.Default
    private int size = 0;
    @Builder.Default
    private SortField sortBy = SortField.CREATED_AT;
    @Builder.Default
    private boolean descending = true;

    public static SilenceFilter all() {
        return SilenceFilter.builder().build();
    }

    public enum SortField {
        CREATED_AT("createdAt"),
        STARTS_AT("startsAt"),
        ENDS_AT("endsAt"),
        UPDATED_AT("updatedAt");

        private final String property;

        SortField(String property) {
            this.property = property;
        }

        public String getProperty() {
            return property;
        }

        public static SortField parse(String value) {
            if (value == null || value.isBlank()) {
                return CREATED_AT;
            }
            String normalized = value.trim().replace("_", "").toLowerCase(Locale.ROOT);
            for (SortField field : values()) {
                if (field.property.toLowerCase(Locale.ROOT).equals(normalized)) {
                    return field;
                }
            }
            throw new ValidationException("sort", "valid_sort_field",
                    "Cannot sort silences by " + value + " (allowed: created_at, starts_at, ends_at, updated_at)");
        }
    }
}
