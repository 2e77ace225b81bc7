package com.auditra.compliance.engine;

import com.auditra.compliance.catalog.RuleCatalog;
import com.auditra.compliance.catalog.RuleCatalogRegistry;
import com.auditra.compliance.config.ComplianceProperties;
import com.auditra.compliance.domain.ComplianceRule;
import com.auditra.compliance.domain.ComplianceStatus;
import com.auditra.compliance.domain.PolicyType;
import com.auditra.compliance.domain.Severity;
import com.auditra.compliance.domain.Transaction;
import com.auditra.compliance.domain.ValidationResult;
import com.auditra.compliance.domain.Violation;
import com.auditra.compliance.exception.ComplianceValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Evaluates every rule of a policy type against every transaction of a batch.
 *
 * Output ordering is fixed: violations are grouped by transaction in input order
 * and, within a transaction, by catalog rule order. Large batches are split into
 * contiguous index ranges evaluated on the rule evaluation executor; the ranges
 * are concatenated in index order so parallel and sequential runs produce the
 * same sequence.
 */
@Slf4j
@Component
public class ComplianceValidator {

    private final RuleCatalogRegistry catalogRegistry;
    private final RuleEvaluator ruleEvaluator;
    private final ExecutorService executor;
    private final ComplianceProperties.EvaluationProperties evaluation;

    public ComplianceValidator(RuleCatalogRegistry catalogRegistry,
                               RuleEvaluator ruleEvaluator,
                               @Qualifier("ruleEvaluationExecutor") ExecutorService executor,
                               ComplianceProperties properties) {
        this.catalogRegistry = catalogRegistry;
        this.ruleEvaluator = ruleEvaluator;
        this.executor = executor;
        this.evaluation = properties.getEvaluation();
    }

    /**
     * Boundary entry point for loosely typed callers
     *
     * @throws ComplianceValidationException if the policy type is unrecognized or the batch is empty
     */
    public ValidationResult validate(List<Transaction> transactions, String policyType) {
        return validate(transactions, PolicyType.parse(policyType));
    }

    public ValidationResult validate(List<Transaction> transactions, PolicyType policyType) {
        return validate(transactions, policyType, catalogRegistry.current());
    }

    /**
     * Validate against an explicit catalog snapshot
     */
    public ValidationResult validate(List<Transaction> transactions, PolicyType policyType, RuleCatalog catalog) {
        requireValidInput(transactions, policyType);

        List<ComplianceRule> rules = catalog.rulesFor(policyType);
        log.debug("Validating {} transactions against {} {} rules (catalog {})",
            transactions.size(), rules.size(), policyType, catalog.version());

        List<Violation> violations = shouldParallelize(transactions.size())
            ? evaluateInParallel(transactions, rules)
            : evaluateRange(transactions, 0, transactions.size(), rules);

        ComplianceStatus status = ComplianceStatus.from(transactions.size(), violations);
        log.info("Validated {} transactions for {}: {} violations, status {}",
            transactions.size(), policyType, violations.size(), status.getOverallStatus());
        return new ValidationResult(policyType, violations, status);
    }

    /**
     * Validate, then keep only violations at or above the severity threshold and
     * aggregate those.
     */
    public ValidationResult checkStatus(List<Transaction> transactions, PolicyType policyType,
                                        Severity severityThreshold, RuleCatalog catalog) {
        ValidationResult full = validate(transactions, policyType, catalog);
        Severity threshold = severityThreshold != null ? severityThreshold : Severity.LOW;
        List<Violation> filtered = full.violations().stream()
            .filter(violation -> violation.getSeverity().isAtLeast(threshold))
            .toList();
        return new ValidationResult(policyType, filtered, ComplianceStatus.from(transactions.size(), filtered));
    }

    private void requireValidInput(List<Transaction> transactions, PolicyType policyType) {
        if (policyType == null) {
            throw ComplianceValidationException.unknownPolicyType(null, "AML, FINANCIAL, REGULATORY");
        }
        if (transactions == null || transactions.isEmpty()) {
            throw ComplianceValidationException.emptyTransactionSet();
        }
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < transactions.size(); i++) {
            if (transactions.get(i) == null) {
                errors.add("Transaction at index " + i + " is null");
            }
        }
        if (!errors.isEmpty()) {
            throw new ComplianceValidationException("Transaction set contains invalid entries", errors);
        }
    }

    private boolean shouldParallelize(int size) {
        return evaluation.isParallelEnabled() && evaluation.getThreads() > 1 && size >= evaluation.getParallelThreshold();
    }

    private List<Violation> evaluateInParallel(List<Transaction> transactions, List<ComplianceRule> rules) {
        int size = transactions.size();
        int chunks = Math.min(evaluation.getThreads(), size);
        int chunkSize = (size + chunks - 1) / chunks;

        List<CompletableFuture<List<Violation>>> futures = new ArrayList<>();
        for (int start = 0; start < size; start += chunkSize) {
            int from = start;
            int to = Math.min(start + chunkSize, size);
            futures.add(CompletableFuture.supplyAsync(() -> evaluateRange(transactions, from, to, rules), executor));
        }

        List<Violation> violations = new ArrayList<>();
        for (CompletableFuture<List<Violation>> future : futures) {
            try {
                violations.addAll(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw e;
            }
        }
        return violations;
    }

    private List<Violation> evaluateRange(List<Transaction> transactions, int from, int to, List<ComplianceRule> rules) {
        List<Violation> violations = new ArrayList<>();
        for (int i = from; i < to; i++) {
            Transaction transaction = transactions.get(i);
            for (ComplianceRule rule : rules) {
                ruleEvaluator.evaluate(rule, transaction).ifPresent(violations::add);
            }
        }
        return violations;
    }
}
