package com.auditra.compliance.engine;

import com.auditra.compliance.catalog.RuleCatalog;
import com.auditra.compliance.domain.ComplianceRule;
import com.auditra.compliance.domain.PolicyType;
import com.auditra.compliance.domain.RiskCategory;
import com.auditra.compliance.domain.Severity;
import com.auditra.compliance.domain.Transaction;
import com.auditra.compliance.domain.Violation;
import com.auditra.compliance.support.ComplianceFixtures;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.auditra.compliance.support.ComplianceFixtures.transaction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("Rule evaluator")
class RuleEvaluatorTest {

    private static RuleCatalog catalog;
    private final RuleEvaluator evaluator = new RuleEvaluator();

    @BeforeAll
    static void loadCatalog() {
        catalog = ComplianceFixtures.defaultCatalog();
    }

    private List<Violation> evaluateAml(Transaction transaction) {
        return catalog.rulesFor(PolicyType.AML).stream()
            .map(rule -> evaluator.evaluate(rule, transaction))
            .flatMap(Optional::stream)
            .toList();
    }

    @Test
    @DisplayName("A EUR 150,000 wire to the USA triggers only the high value rule")
    void highValueWireTriggersSingleRule() {
        Transaction transaction = transaction("TX-1", "150000", "USA", "WIRE", null);

        List<Violation> violations = evaluateAml(transaction);

        assertThat(violations).singleElement().satisfies(violation -> {
            assertThat(violation.getRuleId()).isEqualTo("high_value_transaction");
            assertThat(violation.getRuleName()).isEqualTo("High Value Transaction");
            assertThat(violation.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(violation.getTransactionId()).isEqualTo("TX-1");
            assertThat(violation.getExplanation())
                .contains("Transaction amount \u20AC150,000.00 meets or exceeds \u20AC100,000.00 threshold");
            assertThat(violation.getCountry()).isEqualTo("USA");
            assertThat(violation.getPaymentMethod()).isEqualTo("WIRE");
        });
    }

    @Test
    @DisplayName("A EUR 4,000 high-risk transaction from Russia triggers country and SAR rules")
    void highRiskRussiaTriggersTwoRules() {
        Transaction transaction = transaction("TX-2", "4000", "Russia", "CARD", RiskCategory.HIGH);

        List<Violation> violations = evaluateAml(transaction);

        assertThat(violations).extracting(Violation::getRuleId, Violation::getSeverity)
            .containsExactly(
                tuple("high_risk_country", Severity.CRITICAL),
                tuple("sar_threshold", Severity.HIGH));
    }

    @Test
    @DisplayName("Should require every condition of a rule to match")
    void shouldCombineConditionsByConjunction() {
        ComplianceRule ctr = catalog.findRule("ctr_threshold").orElseThrow();

        assertThat(evaluator.evaluate(ctr, transaction("A", "7500", "France", "CASH", null))).isPresent();
        assertThat(evaluator.evaluate(ctr, transaction("B", "7500", "France", "WIRE", null))).isEmpty();
        assertThat(evaluator.evaluate(ctr, transaction("C", "4999.99", "France", "CASH", null))).isEmpty();
    }

    @Test
    @DisplayName("Should return the same violation for repeated evaluation")
    void shouldBeDeterministic() {
        ComplianceRule rule = catalog.findRule("pep_transaction").orElseThrow();
        Transaction transaction = transaction("TX-3", "1000", "Spain", "ACH", RiskCategory.PEP);

        assertThat(evaluator.evaluate(rule, transaction)).isEqualTo(evaluator.evaluate(rule, transaction));
    }
}
