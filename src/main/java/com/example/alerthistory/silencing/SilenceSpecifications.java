package com.example.alerthistory.silencing;

import com.example.alerthistory.domain.Silence;
import com.example.alerthistory.domain.SilenceMatcher;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Translates a {@link SilenceFilter} into a JPA criteria query.
 * Derived statuses become time-window predicates evaluated at {@code now}.
 */
final class SilenceSpecifications {

    private SilenceSpecifications() {
    }

    static Specification<Silence> matching(SilenceFilter filter, Instant now) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (filter.getStatuses() != null && !filter.getStatuses().isEmpty()
                    && filter.getStatuses().size() < SilenceStatus.values().length) {
                List<Predicate> anyStatus = new ArrayList<>();
                for (SilenceStatus status : filter.getStatuses()) {
                    anyStatus.add(statusPredicate(status, root, cb, now));
                }
                predicates.add(cb.or(anyStatus.toArray(new Predicate[0])));
            }

            if (filter.getCreatedBy() != null && !filter.getCreatedBy().isBlank()) {
                predicates.add(cb.equal(root.get("createdBy"), filter.getCreatedBy()));
            }

            boolean byName = filter.getMatcherName() != null && !filter.getMatcherName().isBlank();
            boolean byValue = filter.getMatcherValue() != null && !filter.getMatcherValue().isBlank();
            if (byName || byValue) {
                Join<Silence, SilenceMatcher> matchers = root.join("matchers");
                if (byName) predicates.add(cb.equal(matchers.get("name"), filter.getMatcherName()));
                if (byValue) predicates.add(cb.equal(matchers.get("value"), filter.getMatcherValue()));
                query.distinct(true);
            }

            if (filter.getStartsAfter() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("startsAt"), filter.getStartsAfter()));
            }
            if (filter.getStartsBefore() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("startsAt"), filter.getStartsBefore()));
            }
            if (filter.getEndsAfter() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("endsAt"), filter.getEndsAfter()));
            }
            if (filter.getEndsBefore() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("endsAt"), filter.getEndsBefore()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static Predicate statusPredicate(SilenceStatus status, Root<Silence> root, CriteriaBuilder cb, Instant now) {
        return switch (status) {
            case PENDING -> cb.greaterThan(root.get("startsAt"), now);
            case ACTIVE -> cb.and(
                    cb.lessThanOrEqualTo(root.get("startsAt"), now),
                    cb.greaterThan(root.get("endsAt"), now));
            case EXPIRED -> cb.lessThanOrEqualTo(root.get("endsAt"), now);
        };
    }
}
