package com.example.alerthistory.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One active inhibition: the target alert is suppressed by the source alert under the named rule.
 * Keyed by target fingerprint; at most one inhibitor is recorded per target.
 */
@Entity
@Table(name = "inhibition_states", indexes = {
        @Index(name = "idx_inhibition_states_source", columnList = "source_fingerprint")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class InhibitionState {

    @Id
    @Column(name = "target_fingerprint", nullable = false)
    private String targetFingerprint;

    @Column(name = "source_fingerprint", nullable = false)
    private String sourceFingerprint;

    @Column(name = "rule_name", nullable = false)
    private String ruleName;

    @Column(name = "inhibited_at", nullable = false)
    private Instant inhibitedAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean sameRelationship(InhibitionState other) {
        return other != null
                && targetFingerprint.equals(other.targetFingerprint)
                && sourceFingerprint.equals(other.sourceFingerprint)
                && ruleName.equals(other.ruleName);
    }
}
