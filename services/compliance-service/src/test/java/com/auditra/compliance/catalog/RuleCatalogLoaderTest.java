package com.auditra.compliance.catalog;

import com.auditra.compliance.config.ComplianceProperties;
import com.auditra.compliance.domain.ComplianceRule;
import com.auditra.compliance.domain.PolicyType;
import com.auditra.compliance.domain.Severity;
import com.auditra.compliance.domain.condition.AmountThresholdCondition;
import com.auditra.compliance.domain.condition.ComparisonOperator;
import com.auditra.compliance.domain.condition.ConditionType;
import com.auditra.compliance.exception.CatalogException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Rule catalog loading")
class RuleCatalogLoaderTest {

    private RuleCatalogLoader loader;

    @BeforeEach
    void setUp() {
        loader = new RuleCatalogLoader(new DefaultResourceLoader(), new ComplianceProperties());
    }

    private RuleCatalog parse(String yaml) {
        return loader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "inline");
    }

    @Nested
    @DisplayName("Default catalog")
    class DefaultCatalog {

        @Test
        @DisplayName("Should load the five AML rules ordered by rule id")
        void shouldLoadAmlRulesInIdOrder() {
            RuleCatalog catalog = loader.load("classpath:rules/compliance-rules.yml");

            assertThat(catalog.rulesFor(PolicyType.AML))
                .extracting(ComplianceRule::getRuleId)
                .containsExactly("ctr_threshold", "high_risk_country", "high_value_transaction",
                    "pep_transaction", "sar_threshold");
            assertThat(catalog.rulesFor(PolicyType.FINANCIAL)).hasSize(1);
            assertThat(catalog.rulesFor(PolicyType.REGULATORY)).hasSize(1);
            assertThat(catalog.version()).isEqualTo("2024.06-1");
        }

        @Test
        @DisplayName("Should keep threshold, operator and severity of the high value rule")
        void shouldParseHighValueRule() {
            RuleCatalog catalog = loader.load("classpath:rules/compliance-rules.yml");

            ComplianceRule rule = catalog.findRule("high_value_transaction").orElseThrow();
            assertThat(rule.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(rule.getConditions()).singleElement()
                .isInstanceOfSatisfying(AmountThresholdCondition.class, condition -> {
                    assertThat(condition.getThreshold()).isEqualByComparingTo("100000");
                    assertThat(condition.getOperator()).isEqualTo(ComparisonOperator.GREATER_THAN_OR_EQUAL);
                    assertThat(condition.getCurrency()).isEqualTo("EUR");
                });
            assertThat(rule.getRequirements()).contains("Enhanced due diligence required");
        }

        @Test
        @DisplayName("Should parse the SAR rule with a strict operator and a risk category set")
        void shouldParseSarRule() {
            ComplianceRule rule = loader.load("classpath:rules/compliance-rules.yml").findRule("sar_threshold").orElseThrow();

            assertThat(rule.declares(ConditionType.AMOUNT_THRESHOLD)).isTrue();
            assertThat(rule.declares(ConditionType.RISK_CATEGORY_SET)).isTrue();
            assertThat(rule.declares(ConditionType.COUNTRY_SET)).isFalse();
            assertThat(((AmountThresholdCondition) rule.getConditions().get(0)).getOperator())
                .isEqualTo(ComparisonOperator.GREATER_THAN);
        }
    }

    @Nested
    @DisplayName("Malformed catalogs")
    class MalformedCatalogs {

        @Test
        @DisplayName("Should report every problem of a malformed catalog at once")
        void shouldCollectAllProblems() {
            assertThatThrownBy(() -> loader.load("classpath:rules/malformed-rules.yml"))
                .isInstanceOf(CatalogException.class)
                .satisfies(ex -> assertThat(((CatalogException) ex).getProblems())
                    .hasSize(3)
                    .anyMatch(problem -> problem.contains("without a threshold"))
                    .anyMatch(problem -> problem.contains("unknown severity 'SEVERE'"))
                    .anyMatch(problem -> problem.contains("condition set is empty")));
        }

        @Test
        @DisplayName("Should fail when the source does not exist")
        void shouldFailOnMissingSource() {
            assertThatThrownBy(() -> loader.load("classpath:rules/does-not-exist.yml"))
                .isInstanceOf(CatalogException.class)
                .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("Should reject duplicate rule ids")
        void shouldRejectDuplicateIds() {
            String yaml = """
                version: "1"
                rules:
                  - id: dup
                    name: First
                    policyType: AML
                    severity: LOW
                    remediationAction: Review
                    conditions:
                      - type: COUNTRY_SET
                        values: [Iran]
                  - id: dup
                    name: Second
                    policyType: AML
                    severity: LOW
                    remediationAction: Review
                    conditions:
                      - type: COUNTRY_SET
                        values: [Cuba]
                """;

            assertThatThrownBy(() -> parse(yaml))
                .isInstanceOf(CatalogException.class)
                .hasMessageContaining("Duplicate rule id: dup");
        }

        @Test
        @DisplayName("Should reject non-positive thresholds and unknown operators")
        void shouldRejectBadAmountConditions() {
            String yaml = """
                version: "1"
                rules:
                  - id: zero
                    name: Zero
                    policyType: AML
                    severity: LOW
                    remediationAction: Review
                    conditions:
                      - type: AMOUNT_THRESHOLD
                        threshold: 0
                  - id: operator
                    name: Operator
                    policyType: AML
                    severity: LOW
                    remediationAction: Review
                    conditions:
                      - type: AMOUNT_THRESHOLD
                        operator: "<"
                        threshold: 10
                """;

            assertThatThrownBy(() -> parse(yaml))
                .isInstanceOf(CatalogException.class)
                .satisfies(ex -> assertThat(((CatalogException) ex).getProblems())
                    .containsExactly(
                        "rule 'zero': amount threshold must be positive, was 0",
                        "rule 'operator': unknown comparison operator '<'"));
        }

        @Test
        @DisplayName("Should reject unknown policy types, risk categories and empty value lists")
        void shouldRejectUnknownEnumsAndEmptySets() {
            String yaml = """
                version: "1"
                rules:
                  - id: policy
                    name: Policy
                    policyType: TAX
                    severity: LOW
                    remediationAction: Review
                    conditions:
                      - type: RISK_CATEGORY_SET
                        values: [VERY_HIGH]
                  - id: empty
                    name: Empty
                    policyType: AML
                    severity: LOW
                    remediationAction: Review
                    conditions:
                      - type: PAYMENT_METHOD_SET
                        values: []
                """;

            assertThatThrownBy(() -> parse(yaml))
                .isInstanceOf(CatalogException.class)
                .satisfies(ex -> assertThat(((CatalogException) ex).getProblems())
                    .containsExactlyInAnyOrder(
                        "rule 'policy': unknown policy type 'TAX'",
                        "rule 'policy': unknown risk category 'VERY_HIGH'",
                        "rule 'empty': PAYMENT_METHOD_SET condition has no values"));
        }

        @Test
        @DisplayName("Should reject a catalog without a version or in another reference currency")
        void shouldRejectMissingVersionAndCurrencyMismatch() {
            String yaml = """
                referenceCurrency: USD
                rules: []
                """;

            assertThatThrownBy(() -> parse(yaml))
                .isInstanceOf(CatalogException.class)
                .satisfies(ex -> assertThat(((CatalogException) ex).getProblems()).hasSize(2));
        }

        @Test
        @DisplayName("Should report an empty rule entry as a catalog problem")
        void shouldRejectEmptyRuleEntry() {
            String yaml = """
                version: "1"
                rules:
                  -
                """;

            assertThatThrownBy(() -> parse(yaml))
                .isInstanceOf(CatalogException.class)
                .satisfies(ex -> assertThat(((CatalogException) ex).getProblems())
                    .containsExactly("rule #1: rule definition is empty"));
        }

        @Test
        @DisplayName("Should report an empty condition entry as a catalog problem")
        void shouldRejectEmptyConditionEntry() {
            String yaml = """
                version: "1"
                rules:
                  - id: blank_condition
                    name: Blank Condition
                    policyType: AML
                    severity: LOW
                    remediationAction: Review
                    conditions:
                      - type: COUNTRY_SET
                        values: [Iran]
                      -
                """;

            assertThatThrownBy(() -> parse(yaml))
                .isInstanceOf(CatalogException.class)
                .satisfies(ex -> assertThat(((CatalogException) ex).getProblems())
                    .containsExactly("rule 'blank_condition': condition #2 is empty"));
        }

        @Test
        @DisplayName("Should reject content that is not YAML for the catalog model")
        void shouldRejectUnparseableContent() {
            assertThatThrownBy(() -> parse("version: [unterminated"))
                .isInstanceOf(CatalogException.class)
                .hasMessageContaining("not valid YAML");
        }
    }

    @Test
    @DisplayName("Should default a missing operator to meets-or-exceeds")
    void shouldDefaultOperator() {
        RuleCatalog catalog = loader.load("classpath:rules/test-rules.yml");

        AmountThresholdCondition condition = (AmountThresholdCondition) catalog.findRule("b_large_amount")
            .orElseThrow().getConditions().get(0);
        assertThat(condition.getOperator()).isEqualTo(ComparisonOperator.GREATER_THAN_OR_EQUAL);
        assertThat(condition.getThreshold()).isEqualByComparingTo(BigDecimal.valueOf(10000));
        assertThat(catalog.allRules()).extracting(ComplianceRule::getRuleId)
            .isEqualTo(List.of("a_watch_country", "b_large_amount", "ledger_review"));
    }
}
