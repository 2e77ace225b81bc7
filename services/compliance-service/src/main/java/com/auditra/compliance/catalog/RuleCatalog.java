package com.auditra.compliance.catalog;

import com.auditra.compliance.domain.ComplianceRule;
import com.auditra.compliance.domain.PolicyType;
import com.auditra.compliance.exception.CatalogException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of compliance rules, grouped by policy type and ordered by rule id.
 * Instances are never modified; a reload builds a new catalog.
 */
public final class RuleCatalog {

    private static final Comparator<ComplianceRule> BY_RULE_ID = Comparator.comparing(ComplianceRule::getRuleId);

    private final String version;
    private final List<ComplianceRule> allRules;
    private final Map<PolicyType, List<ComplianceRule>> rulesByPolicy;

    private RuleCatalog(String version, List<ComplianceRule> rules) {
        this.version = version;
        List<ComplianceRule> sorted = new ArrayList<>(rules);
        sorted.sort(BY_RULE_ID);
        this.allRules = List.copyOf(sorted);

        Map<PolicyType, List<ComplianceRule>> grouped = new EnumMap<>(PolicyType.class);
        for (PolicyType type : PolicyType.values()) {
            grouped.put(type, sorted.stream().filter(rule -> rule.getPolicyType() == type).toList());
        }
        this.rulesByPolicy = grouped;
    }

    /**
     * @throws CatalogException if two rules share an identifier
     */
    public static RuleCatalog of(String version, List<ComplianceRule> rules) {
        Set<String> seen = new HashSet<>();
        List<String> duplicates = new ArrayList<>();
        for (ComplianceRule rule : rules) {
            if (!seen.add(rule.getRuleId())) {
                duplicates.add("Duplicate rule id: " + rule.getRuleId());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new CatalogException("version " + version, duplicates);
        }
        return new RuleCatalog(version, rules);
    }

    /**
     * Rules for a policy type in ascending rule-id order; empty when the type has none
     */
    public List<ComplianceRule> rulesFor(PolicyType policyType) {
        return rulesByPolicy.getOrDefault(policyType, List.of());
    }

    public Optional<ComplianceRule> findRule(String ruleId) {
        return allRules.stream().filter(rule -> rule.getRuleId().equals(ruleId)).findFirst();
    }

    public List<ComplianceRule> allRules() {
        return allRules;
    }

    public String version() {
        return version;
    }

    public int size() {
        return allRules.size();
    }

    @Override
    public String toString() {
        return "RuleCatalog[version=" + version + ", rules=" + allRules.size() + "]";
    }
}
