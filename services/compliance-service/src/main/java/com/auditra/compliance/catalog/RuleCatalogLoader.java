package com.auditra.compliance.catalog;

import com.auditra.compliance.catalog.RuleCatalogDocument.ConditionDefinition;
import com.auditra.compliance.catalog.RuleCatalogDocument.RuleDefinition;
import com.auditra.compliance.config.ComplianceProperties;
import com.auditra.compliance.domain.ComplianceRule;
import com.auditra.compliance.domain.PolicyType;
import com.auditra.compliance.domain.RiskCategory;
import com.auditra.compliance.domain.Severity;
import com.auditra.compliance.domain.condition.AmountThresholdCondition;
import com.auditra.compliance.domain.condition.ComparisonOperator;
import com.auditra.compliance.domain.condition.ConditionType;
import com.auditra.compliance.domain.condition.CountrySetCondition;
import com.auditra.compliance.domain.condition.PaymentMethodSetCondition;
import com.auditra.compliance.domain.condition.RiskCategorySetCondition;
import com.auditra.compliance.domain.condition.RuleCondition;
import com.auditra.compliance.exception.CatalogException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the versioned YAML rule source and turns it into an immutable {@link RuleCatalog}.
 *
 * Every problem in the document is collected before failing.
 */
@Slf4j
@Component
public class RuleCatalogLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ResourceLoader resourceLoader;
    private final String referenceCurrency;

    public RuleCatalogLoader(ResourceLoader resourceLoader, ComplianceProperties properties) {
        this.resourceLoader = resourceLoader;
        this.referenceCurrency = properties.getCurrency().getReferenceCurrency();
    }

    /**
     * Load the catalog from a Spring resource location such as {@code classpath:rules/compliance-rules.yml}
     *
     * @throws CatalogException if the source is missing, unreadable or malformed
     */
    public RuleCatalog load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CatalogException("Rule catalog source not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            RuleCatalog catalog = parse(in, location);
            log.info("Loaded rule catalog {} from {}: {} rules", catalog.version(), location, catalog.size());
            return catalog;
        } catch (IOException e) {
            throw new CatalogException("Unable to read rule catalog source " + location, e);
        }
    }

    public RuleCatalog parse(InputStream in, String sourceName) {
        RuleCatalogDocument document;
        try {
            document = yamlMapper.readValue(in, RuleCatalogDocument.class);
        } catch (JsonProcessingException e) {
            throw new CatalogException("Rule catalog " + sourceName + " is not valid YAML: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CatalogException("Unable to read rule catalog " + sourceName, e);
        }
        if (document == null) {
            throw new CatalogException("Rule catalog " + sourceName + " is empty");
        }
        return toCatalog(document, sourceName);
    }

    RuleCatalog toCatalog(RuleCatalogDocument document, String sourceName) {
        List<String> problems = new ArrayList<>();

        if (isBlank(document.getVersion())) {
            problems.add("Catalog version is missing");
        }
        if (document.getReferenceCurrency() != null
                && !document.getReferenceCurrency().equalsIgnoreCase(referenceCurrency)) {
            problems.add(String.format("Catalog reference currency %s does not match configured reference currency %s",
                document.getReferenceCurrency(), referenceCurrency));
        }

        List<ComplianceRule> rules = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        List<RuleDefinition> definitions = document.getRules() != null ? document.getRules() : List.of();
        for (int i = 0; i < definitions.size(); i++) {
            RuleDefinition definition = definitions.get(i);
            if (definition == null) {
                problems.add("rule #" + (i + 1) + ": rule definition is empty");
                continue;
            }
            String label = isBlank(definition.getId()) ? "rule #" + (i + 1) : "rule '" + definition.getId() + "'";
            if (!isBlank(definition.getId()) && !ids.add(definition.getId())) {
                problems.add("Duplicate rule id: " + definition.getId());
            }
            toRule(definition, label, problems).ifPresent(rules::add);
        }

        if (!problems.isEmpty()) {
            throw new CatalogException(sourceName, problems);
        }
        return RuleCatalog.of(document.getVersion(), rules);
    }

    private Optional<ComplianceRule> toRule(RuleDefinition definition, String label, List<String> problems) {
        int before = problems.size();

        if (isBlank(definition.getId())) {
            problems.add(label + ": id is missing");
        }
        if (isBlank(definition.getName())) {
            problems.add(label + ": name is missing");
        }
        if (isBlank(definition.getRemediationAction())) {
            problems.add(label + ": remediation action is missing");
        }
        Optional<PolicyType> policyType = PolicyType.fromValue(definition.getPolicyType());
        if (policyType.isEmpty()) {
            problems.add(label + ": unknown policy type '" + definition.getPolicyType() + "'");
        }
        Optional<Severity> severity = Severity.fromValue(definition.getSeverity());
        if (severity.isEmpty()) {
            problems.add(label + ": unknown severity '" + definition.getSeverity() + "'");
        }

        List<RuleCondition> conditions = new ArrayList<>();
        if (definition.getConditions() == null || definition.getConditions().isEmpty()) {
            problems.add(label + ": condition set is empty");
        } else {
            List<ConditionDefinition> definitions = definition.getConditions();
            for (int i = 0; i < definitions.size(); i++) {
                ConditionDefinition condition = definitions.get(i);
                if (condition == null) {
                    problems.add(label + ": condition #" + (i + 1) + " is empty");
                    continue;
                }
                toCondition(condition, label, problems).ifPresent(conditions::add);
            }
        }

        if (problems.size() > before) {
            return Optional.empty();
        }
        return Optional.of(ComplianceRule.builder()
            .ruleId(definition.getId().trim())
            .name(definition.getName().trim())
            .description(definition.getDescription())
            .policyType(policyType.get())
            .severity(severity.get())
            .remediationAction(definition.getRemediationAction().trim())
            .recommendation(isBlank(definition.getRecommendation()) ? null : definition.getRecommendation().trim())
            .requirements(definition.getRequirements() != null ? definition.getRequirements() : List.of())
            .conditions(conditions)
            .build());
    }

    private Optional<RuleCondition> toCondition(ConditionDefinition definition, String label, List<String> problems) {
        ConditionType type = parseConditionType(definition.getType());
        if (type == null) {
            problems.add(label + ": unknown condition type '" + definition.getType() + "'");
            return Optional.empty();
        }

        switch (type) {
            case AMOUNT_THRESHOLD:
                return amountCondition(definition, label, problems);
            case COUNTRY_SET:
                return requireValues(definition, label, type, problems)
                    .map(CountrySetCondition::new);
            case PAYMENT_METHOD_SET:
                return requireValues(definition, label, type, problems)
                    .map(PaymentMethodSetCondition::new);
            case RISK_CATEGORY_SET:
                return riskCategoryCondition(definition, label, problems);
            default:
                problems.add(label + ": unsupported condition type " + type);
                return Optional.empty();
        }
    }

    private Optional<RuleCondition> amountCondition(ConditionDefinition definition, String label, List<String> problems) {
        BigDecimal threshold = definition.getThreshold();
        if (threshold == null) {
            problems.add(label + ": amount threshold condition declared without a threshold");
            return Optional.empty();
        }
        if (threshold.signum() <= 0) {
            problems.add(label + ": amount threshold must be positive, was " + threshold.toPlainString());
            return Optional.empty();
        }
        Optional<ComparisonOperator> operator = definition.getOperator() == null
            ? Optional.of(ComparisonOperator.GREATER_THAN_OR_EQUAL)
            : ComparisonOperator.fromValue(definition.getOperator());
        if (operator.isEmpty()) {
            problems.add(label + ": unknown comparison operator '" + definition.getOperator() + "'");
            return Optional.empty();
        }
        return Optional.of(new AmountThresholdCondition(threshold, operator.get(), referenceCurrency));
    }

    private Optional<RuleCondition> riskCategoryCondition(ConditionDefinition definition, String label, List<String> problems) {
        Optional<List<String>> values = requireValues(definition, label, ConditionType.RISK_CATEGORY_SET, problems);
        if (values.isEmpty()) {
            return Optional.empty();
        }
        List<RiskCategory> categories = new ArrayList<>();
        boolean valid = true;
        for (String value : values.get()) {
            Optional<RiskCategory> category = RiskCategory.fromValue(value);
            if (category.isPresent()) {
                categories.add(category.get());
            } else {
                problems.add(label + ": unknown risk category '" + value + "'");
                valid = false;
            }
        }
        return valid ? Optional.of(new RiskCategorySetCondition(categories)) : Optional.empty();
    }

    private Optional<List<String>> requireValues(ConditionDefinition definition, String label,
                                                 ConditionType type, List<String> problems) {
        List<String> values = definition.getValues() == null ? List.of() : definition.getValues().stream()
            .filter(value -> !isBlank(value))
            .toList();
        if (values.isEmpty()) {
            problems.add(label + ": " + type + " condition has no values");
            return Optional.empty();
        }
        return Optional.of(values);
    }

    private static ConditionType parseConditionType(String value) {
        if (value == null) {
            return null;
        }
        for (ConditionType type : ConditionType.values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
