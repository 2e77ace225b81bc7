package com.auditra.compliance.domain;

import com.auditra.compliance.domain.condition.ConditionType;
import com.auditra.compliance.domain.condition.RuleCondition;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * A named policy check. All conditions must match for the rule to trigger;
 * condition types the rule does not declare match every transaction.
 */
@Getter
@Builder
@EqualsAndHashCode
@ToString
public class ComplianceRule {

    private final String ruleId;
    private final String name;
    private final String description;
    private final PolicyType policyType;
    @Singular
    private final List<RuleCondition> conditions;
    private final Severity severity;
    private final String remediationAction;
    @Singular
    private final List<String> requirements;
    private final String recommendation;

    public Optional<String> getRecommendation() {
        return Optional.ofNullable(recommendation);
    }

    public boolean declares(ConditionType type) {
        return conditions.stream().anyMatch(condition -> condition.getType() == type);
    }
}
