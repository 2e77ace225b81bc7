package com.auditra.compliance.catalog;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Versioned rule configuration as stored in the catalog YAML source
 */
@Data
@NoArgsConstructor
public class RuleCatalogDocument {

    private String version;
    private String referenceCurrency;
    private List<RuleDefinition> rules = new ArrayList<>();

    @Data
    @NoArgsConstructor
    public static class RuleDefinition {
        private String id;
        private String name;
        private String description;
        private String policyType;
        private String severity;
        private String remediationAction;
        private String recommendation;
        private List<String> requirements = new ArrayList<>();
        private List<ConditionDefinition> conditions = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    public static class ConditionDefinition {
        private String type;
        private String operator;
        private BigDecimal threshold;
        private List<String> values = new ArrayList<>();
    }
}
