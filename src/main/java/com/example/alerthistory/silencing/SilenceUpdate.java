package com.example.alerthistory.silencing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Partial update of a silence. Null fields are left unchanged; id, creator, start and
 * creation time cannot be changed at all.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SilenceUpdate {

    private String comment;
    private Instant endsAt;
    private List<MatcherSpec> matchers;

    public boolean isEmpty() {
        return comment == null && endsAt == null && matchers == null;
    }
}
