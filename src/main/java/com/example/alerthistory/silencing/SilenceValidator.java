package com.example.alerthistory.silencing;

import com.example.alerthistory.config.AlertHistoryProperties;
import com.example.alerthistory.error.ValidationException;
import com.example.alerthistory.matcher.Matcher;
import com.example.alerthistory.matcher.MatcherEvaluator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Field-level validation of silence requests. Every failure names the field and the constraint.
 */
@Component
@RequiredArgsConstructor
public class SilenceValidator {

    public static final int MIN_COMMENT_LENGTH = 3;
    public static final int MAX_COMMENT_LENGTH = 1024;
    public static final int MAX_CREATOR_LENGTH = 255;

    private static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");
    private static final Pattern UUID = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private final AlertHistoryProperties properties;

    /**
     * Validates a create request and returns its compiled matchers.
     */
    public List<Matcher> validateCreate(SilenceRequest request) {
        if (request == null) {
            throw new ValidationException("body", "required", "Silence request body is required");
        }
        validateCreator(request.getCreatedBy());
        validateComment(request.getComment());
        if (request.getStartsAt() == null) {
            throw new ValidationException("startsAt", "required", "startsAt is required");
        }
        validateTimeRange(request.getStartsAt(), request.getEndsAt());
        return validateMatchers(request.getMatchers());
    }

    public void validateCreator(String createdBy) {
        if (createdBy == null || createdBy.isBlank()) {
            throw new ValidationException("createdBy", "required", "createdBy is required");
        }
        if (createdBy.length() > MAX_CREATOR_LENGTH) {
            throw new ValidationException("createdBy", "max_length",
                    "createdBy must be at most " + MAX_CREATOR_LENGTH + " characters");
        }
        if (!EMAIL.matcher(createdBy).matches()) {
            throw new ValidationException("createdBy", "email", "createdBy must be a valid email address: " + createdBy);
        }
    }

    public void validateComment(String comment) {
        if (comment == null || comment.strip().length() < MIN_COMMENT_LENGTH) {
            throw new ValidationException("comment", "min_length",
                    "comment must be at least " + MIN_COMMENT_LENGTH + " characters");
        }
        if (comment.length() > MAX_COMMENT_LENGTH) {
            throw new ValidationException("comment", "max_length",
                    "comment must be at most " + MAX_COMMENT_LENGTH + " characters");
        }
    }

    public void validateTimeRange(Instant startsAt, Instant endsAt) {
        if (endsAt == null) {
            throw new ValidationException("endsAt", "required", "endsAt is required");
        }
        if (!endsAt.isAfter(startsAt)) {
            throw new ValidationException("endsAt", "after_starts_at",
                    "endsAt (" + endsAt + ") must be after startsAt (" + startsAt + ")");
        }
    }

    public List<Matcher> validateMatchers(List<MatcherSpec> specs) {
        int max = properties.getSilences().getMaxMatchers();
        if (specs == null || specs.isEmpty()) {
            throw new ValidationException("matchers", "min_items", "at least one matcher is required");
        }
        if (specs.size() > max) {
            throw new ValidationException("matchers", "max_items",
                    "at most " + max + " matchers are allowed, got " + specs.size());
        }
        List<Matcher> compiled = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            MatcherSpec spec = specs.get(i);
            if (spec == null) {
                throw new ValidationException("matchers[" + i + "]", "required", "matcher " + i + " is null");
            }
            try {
                compiled.add(Matcher.of(spec.name(), spec.operator(), spec.value()));
            } catch (ValidationException e) {
                throw new ValidationException("matchers[" + i + "]." + e.getField().replace("matchers.", ""),
                        e.getConstraint(), e.getMessage(), e);
            }
        }
        if (MatcherEvaluator.matchesEmpty(compiled)) {
            throw new ValidationException("matchers", "not_catch_all",
                    "at least one matcher must not match an empty label set");
        }
        return compiled;
    }

    public void validateId(String id) {
        if (id == null || !UUID.matcher(id).matches()) {
            throw new ValidationException("id", "uuid", "silence id must be a UUID: " + id);
        }
    }
}
