package com.example.alerthistory.domain;

import com.example.alerthistory.silencing.SilenceStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An operator-defined, time-bounded mute for alerts matching all of its matchers.
 * Status is never stored; it is derived from the time window on every read.
 */
@Entity
@Table(name = "silences", indexes = {
        @Index(name = "idx_silences_created_by", columnList = "created_by"),
        @Index(name = "idx_silences_starts_at", columnList = "starts_at"),
        @Index(name = "idx_silences_ends_at", columnList = "ends_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Silence {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "created_by", nullable = false)
    private String createdBy;

    @Column(nullable = false, length = 1024)
    private String comment;

    @Column(name = "starts_at", nullable = false)
    private Instant startsAt;

    @Column(name = "ends_at", nullable = false)
    private Instant endsAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "silence_matchers", joinColumns = @JoinColumn(name = "silence_id"))
    @OrderColumn(name = "matcher_index")
    @Builder.Default
    private List<SilenceMatcher> matchers = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private long version;

    public SilenceStatus statusAt(Instant now) {
        return SilenceStatus.of(startsAt, endsAt, now);
    }
}
