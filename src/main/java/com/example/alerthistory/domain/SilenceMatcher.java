package com.example.alerthistory.domain;

import com.example.alerthistory.matcher.MatchOperator;
import com.example.alerthistory.matcher.Matcher;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted form of a silence matcher. Compiled into a {@link Matcher} when loaded into the snapshot.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SilenceMatcher {

    @Column(name = "label_name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_operator", nullable = false, length = 16)
    private MatchOperator operator;

    @Column(name = "match_value", nullable = false, length = Matcher.MAX_VALUE_LENGTH)
    private String value;

    public Matcher compile() {
        return Matcher.of(name, operator, value);
    }

    public static SilenceMatcher from(Matcher matcher) {
        return new SilenceMatcher(matcher.getName(), matcher.getOperator(), matcher.getValue());
    }
}
