package com.auditra.compliance.engine;

import com.auditra.compliance.domain.ComplianceRule;
import com.auditra.compliance.domain.Transaction;
import com.auditra.compliance.domain.Violation;
import com.auditra.compliance.domain.condition.RuleCondition;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Applies a single rule to a single transaction.
 *
 * Pure function of its arguments: conditions are combined by conjunction and the
 * first non-matching condition short-circuits. Amounts must already be in the
 * reference currency; no conversion happens here.
 */
@Component
public class RuleEvaluator {

    public Optional<Violation> evaluate(ComplianceRule rule, Transaction transaction) {
        for (RuleCondition condition : rule.getConditions()) {
            if (!condition.matches(transaction)) {
                return Optional.empty();
            }
        }
        return Optional.of(toViolation(rule, transaction));
    }

    private Violation toViolation(ComplianceRule rule, Transaction transaction) {
        String reasons = rule.getConditions().stream()
            .map(condition -> condition.describe(transaction))
            .collect(Collectors.joining("; "));

        return Violation.builder()
            .transactionId(transaction.getTransactionId())
            .ruleId(rule.getRuleId())
            .ruleName(rule.getName())
            .severity(rule.getSeverity())
            .explanation(String.format("%s triggered for transaction %s: %s",
                rule.getName(), transaction.getTransactionId(), reasons))
            .remediationAction(rule.getRemediationAction())
            .amount(transaction.getAmount())
            .currency(transaction.getCurrency())
            .country(transaction.getCountry())
            .paymentMethod(transaction.getPaymentMethod())
            .riskCategory(transaction.getRiskCategory())
            .supplierName(transaction.getSupplierName())
            .build();
    }
}
