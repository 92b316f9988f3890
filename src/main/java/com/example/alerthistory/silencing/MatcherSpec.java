package com.example.alerthistory.silencing;

import com.example.alerthistory.domain.SilenceMatcher;
import com.example.alerthistory.matcher.MatchOperator;

/**
 * Wire and request shape of a matcher: {@code {"name": "severity", "operator": "=~", "value": "critical|warning"}}.
 */
public record MatcherSpec(String name, MatchOperator operator, String value) {

    public static MatcherSpec from(SilenceMatcher matcher) {
        return new MatcherSpec(matcher.getName(), matcher.getOperator(), matcher.getValue());
    }
}
