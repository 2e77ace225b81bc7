package com.auditra.compliance.trail;

import com.auditra.compliance.domain.TimeRange;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

final class AuditTrailSpecifications {

    private AuditTrailSpecifications() {
    }

    static Specification<AuditTrailEntry> matching(TimeRange range, AuditTrailFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.between(root.<LocalDateTime>get("recordedAt"), range.from(), range.to()));
            if (filter != null) {
                if (filter.reportType() != null) {
                    predicates.add(cb.equal(root.get("reportType"), filter.reportType()));
                }
                if (filter.policyType() != null) {
                    predicates.add(cb.equal(root.get("policyType"), filter.policyType()));
                }
                if (filter.overallStatus() != null) {
                    predicates.add(cb.equal(root.get("overallStatus"), filter.overallStatus()));
                }
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
