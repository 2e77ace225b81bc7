package com.auditra.compliance.engine;

import com.auditra.common.exception.ErrorCode;
import com.auditra.compliance.catalog.RuleCatalog;
import com.auditra.compliance.catalog.RuleCatalogRegistry;
import com.auditra.compliance.config.ComplianceProperties;
import com.auditra.compliance.domain.OverallStatus;
import com.auditra.compliance.domain.PolicyType;
import com.auditra.compliance.domain.RiskCategory;
import com.auditra.compliance.domain.Severity;
import com.auditra.compliance.domain.Transaction;
import com.auditra.compliance.domain.ValidationResult;
import com.auditra.compliance.domain.Violation;
import com.auditra.compliance.exception.ComplianceValidationException;
import com.auditra.compliance.support.ComplianceFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.auditra.compliance.support.ComplianceFixtures.transaction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("Compliance validator")
class ComplianceValidatorTest {

    @Mock
    private RuleCatalogRegistry registry;

    private final RuleCatalog catalog = ComplianceFixtures.defaultCatalog();
    private ExecutorService executor;
    private ComplianceProperties properties;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        properties = new ComplianceProperties();
        properties.getEvaluation().setThreads(4);
        when(registry.current()).thenReturn(catalog);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ComplianceValidator validator(boolean parallel, int threshold) {
        properties.getEvaluation().setParallelEnabled(parallel);
        properties.getEvaluation().setParallelThreshold(threshold);
        return new ComplianceValidator(registry, new RuleEvaluator(), executor, properties);
    }

    @Nested
    @DisplayName("Evaluation")
    class Evaluation {

        @Test
        @DisplayName("Should group violations by transaction in input order, then by rule order")
        void shouldOrderByTransactionThenRule() {
            List<Transaction> transactions = List.of(
                transaction("T-B", "4000", "Russia", "CARD", RiskCategory.HIGH),
                transaction("T-A", "150000", "USA", "WIRE", RiskCategory.LOW));

            ValidationResult result = validator(false, 500).validate(transactions, PolicyType.AML);

            assertThat(result.violations())
                .extracting(violation -> violation.getTransactionId() + "/" + violation.getRuleId())
                .containsExactly("T-B/high_risk_country", "T-B/sar_threshold", "T-A/high_value_transaction");
            assertThat(result.status().getTotalViolations()).isEqualTo(3);
            assertThat(result.status().getViolatingTransactions()).isEqualTo(2);
            assertThat(result.status().getHighestSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(result.status().getOverallStatus()).isEqualTo(OverallStatus.NON_COMPLIANT);
        }

        @Test
        @DisplayName("Total violations equals the sum of per-pair evaluations")
        void totalEqualsSumOfPairs() {
            List<Transaction> transactions = ComplianceFixtures.mixedTransactions(25);
            RuleEvaluator evaluator = new RuleEvaluator();

            long expected = transactions.stream()
                .mapToLong(tx -> catalog.rulesFor(PolicyType.AML).stream()
                    .filter(rule -> evaluator.evaluate(rule, tx).isPresent())
                    .count())
                .sum();

            ValidationResult result = validator(false, 500).validate(transactions, PolicyType.AML);

            assertThat(result.status().getTotalViolations()).isEqualTo((int) expected);
            assertThat(expected).isEqualTo(25);
            long severityTotal = result.status().getSeverityCounts().values().stream().mapToLong(Long::longValue).sum();
            assertThat(severityTotal).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should produce identical results on repeated runs")
        void shouldBeDeterministic() {
            List<Transaction> transactions = ComplianceFixtures.mixedTransactions(40);
            ComplianceValidator validator = validator(false, 500);

            ValidationResult first = validator.validate(transactions, PolicyType.AML);
            ValidationResult second = validator.validate(transactions, PolicyType.AML);

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("Parallel and sequential evaluation give the same violation sequence")
        void parallelMatchesSequential() {
            List<Transaction> transactions = ComplianceFixtures.mixedTransactions(1003);

            ValidationResult sequential = validator(false, 10).validate(transactions, PolicyType.AML);
            ValidationResult parallel = validator(true, 10).validate(transactions, PolicyType.AML);

            assertThat(parallel.violations()).containsExactlyElementsOf(sequential.violations());
            assertThat(parallel.status()).isEqualTo(sequential.status());
        }

        @Test
        @DisplayName("100 compliant transactions yield a compliant status with zero counts")
        void compliantBatch() {
            ValidationResult result = validator(true, 50)
                .validate(ComplianceFixtures.compliantTransactions(100), PolicyType.AML);

            assertThat(result.violations()).isEmpty();
            assertThat(result.status().getOverallStatus()).isEqualTo(OverallStatus.COMPLIANT);
            assertThat(result.status().getHighestSeverity()).isNull();
            assertThat(result.status().getSeverityCounts()).hasSize(4).allSatisfy((severity, count) ->
                assertThat(count).isZero());
            assertThat(result.status().getComplianceRate()).isEqualByComparingTo("100.0");
        }

        @Test
        @DisplayName("Should evaluate only the rules of the requested policy type")
        void shouldScopeToPolicyType() {
            List<Transaction> transactions = List.of(
                transaction("T1", "2000000", "Germany", "WIRE", RiskCategory.LOW),
                transaction("T2", "900", "Iran", "CASH", RiskCategory.LOW));

            ValidationResult financial = validator(false, 500).validate(transactions, PolicyType.FINANCIAL);
            ValidationResult regulatory = validator(false, 500).validate(transactions, "regulatory");

            assertThat(financial.violations()).extracting(Violation::getRuleId)
                .containsExactly("material_transaction_review");
            assertThat(regulatory.violations()).extracting(Violation::getRuleId)
                .containsExactly("sanctioned_cash_transfer");
            assertThat(regulatory.policyType()).isEqualTo(PolicyType.REGULATORY);
        }

        @Test
        @DisplayName("Should compute the compliance rate from violating transactions")
        void shouldComputeComplianceRate() {
            List<Transaction> transactions = new ArrayList<>(ComplianceFixtures.compliantTransactions(2));
            transactions.add(transaction("T-BAD", "4000", "Russia", "CARD", RiskCategory.HIGH));

            ValidationResult result = validator(false, 500).validate(transactions, PolicyType.AML);

            assertThat(result.status().getComplianceRate()).isEqualByComparingTo("66.7");
        }
    }

    @Nested
    @DisplayName("Input validation")
    class InputValidation {

        @Test
        @DisplayName("Should reject an empty transaction set")
        void shouldRejectEmptySet() {
            assertThatThrownBy(() -> validator(false, 500).validate(List.of(), PolicyType.AML))
                .isInstanceOf(ComplianceValidationException.class)
                .satisfies(ex -> assertThat(((ComplianceValidationException) ex).getErrorCode())
                    .isEqualTo(ErrorCode.COMPLIANCE_VALIDATION_FAILED));
        }

        @Test
        @DisplayName("Should reject an unrecognized policy type before evaluating")
        void shouldRejectUnknownPolicyType() {
            ComplianceValidator validator = validator(false, 500);

            assertThatThrownBy(() -> validator.validate(ComplianceFixtures.compliantTransactions(1), "TAX"))
                .isInstanceOf(ComplianceValidationException.class)
                .hasMessageContaining("Unknown policy type: TAX");
            verify(registry, never()).current();
        }

        @Test
        @DisplayName("Should report null entries by index")
        void shouldRejectNullEntries() {
            List<Transaction> transactions = new ArrayList<>(ComplianceFixtures.compliantTransactions(2));
            transactions.add(1, null);

            assertThatThrownBy(() -> validator(false, 500).validate(transactions, PolicyType.AML))
                .isInstanceOf(ComplianceValidationException.class)
                .satisfies(ex -> assertThat(((ComplianceValidationException) ex).getValidationErrors())
                    .containsExactly("Transaction at index 1 is null"));
        }
    }

    @Test
    @DisplayName("Status check keeps only violations at or above the threshold")
    void statusCheckFiltersBySeverity() {
        List<Transaction> transactions = ComplianceFixtures.mixedTransactions(5);

        ValidationResult result = validator(false, 500).checkStatus(transactions, PolicyType.AML, Severity.CRITICAL, catalog);

        assertThat(result.violations()).extracting(Violation::getRuleId).containsExactly("high_risk_country");
        assertThat(result.status().getTotalViolations()).isEqualTo(1);
        assertThat(result.status().getTotalTransactions()).isEqualTo(5);
    }
}
