package com.example.alerthistory.silencing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Operator request to create a silence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SilenceRequest {

    private String createdBy;
    private String comment;
    private Instant startsAt;
    private Instant endsAt;

    @Builder.Default
    private List<MatcherSpec> matchers = new ArrayList<>();
}
