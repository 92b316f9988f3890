package com.example.alerthistory.matcher;

import com.example.alerthistory.error.ValidationException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A single validated label predicate. Regex values are compiled once, here, so evaluation
 * on the alert path never compiles and never fails.
 */
public final class Matcher {

    public static final int MAX_VALUE_LENGTH = 1024;
    private static final Pattern LABEL_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    /** Compiled patterns keyed by source regex, shared across snapshot rebuilds */
    private static final Cache<String, Pattern> PATTERNS = Caffeine.newBuilder()
            .maximumSize(2000)
            .expireAfterAccess(1, TimeUnit.HOURS)
            .build();

    private final String name;
    private final MatchOperator operator;
    private final String value;
    private final Pattern pattern;

    private Matcher(String name, MatchOperator operator, String value, Pattern pattern) {
        this.name = name;
        this.operator = operator;
        this.value = value;
        this.pattern = pattern;
    }

    public static Matcher of(String name, MatchOperator operator, String value) {
        if (!isValidLabelName(name)) {
            throw new ValidationException("matchers.name", "valid_label_name", "Invalid label name: " + name);
        }
        if (operator == null) {
            throw new ValidationException("matchers.operator", "required", "Matcher operator is required for " + name);
        }
        String v = value == null ? "" : value;
        if (v.length() > MAX_VALUE_LENGTH) {
            throw new ValidationException("matchers.value", "max_length",
                    "Matcher value for " + name + " exceeds " + MAX_VALUE_LENGTH + " characters");
        }
        Pattern compiled = null;
        if (operator.isRegex()) {
            compiled = compile("matchers.value", v);
        }
        return new Matcher(name, operator, v, compiled);
    }

    public static Matcher equal(String name, String value) {
        return of(name, MatchOperator.EQUAL, value);
    }

    public static Matcher regex(String name, String value) {
        return of(name, MatchOperator.REGEX, value);
    }

    /**
     * Compiles an anchored pattern. The raw value is compiled on its own first, so an unbalanced
     * value such as {@code x)|(.*} is rejected instead of becoming valid inside the anchoring group.
     */
    public static Pattern compile(String field, String regex) {
        Pattern cached = PATTERNS.getIfPresent(regex);
        if (cached != null) {
            return cached;
        }
        try {
            Pattern.compile(regex);
            Pattern compiled = Pattern.compile("^(?:" + regex + ")$");
            PATTERNS.put(regex, compiled);
            return compiled;
        } catch (PatternSyntaxException e) {
            throw new ValidationException(field, "valid_regex",
                    "Invalid regular expression \"" + regex + "\" in " + field + ": " + e.getDescription(), e);
        }
    }

    public static boolean isValidLabelName(String name) {
        return name != null && LABEL_NAME.matcher(name).matches();
    }

    public boolean matches(Map<String, String> labels) {
        String actual = labels.getOrDefault(name, "");
        return switch (operator) {
            case EQUAL -> actual.equals(value);
            case NOT_EQUAL -> !actual.equals(value);
            case REGEX -> pattern.matcher(actual).matches();
            case NOT_REGEX -> !pattern.matcher(actual).matches();
        };
    }

    public String getName() {
        return name;
    }

    public MatchOperator getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Matcher other)) return false;
        return name.equals(other.name) && operator == other.operator && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, operator, value);
    }

    @Override
    public String toString() {
        return name + operator.getSymbol() + "\"" + value + "\"";
    }
}
