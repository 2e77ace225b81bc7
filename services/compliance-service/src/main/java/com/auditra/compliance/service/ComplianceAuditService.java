package com.auditra.compliance.service;

import com.auditra.compliance.catalog.RuleCatalog;
import com.auditra.compliance.catalog.RuleCatalogRegistry;
import com.auditra.compliance.config.ComplianceProperties;
import com.auditra.compliance.domain.AuditReport;
import com.auditra.compliance.domain.ComplianceRule;
import com.auditra.compliance.domain.PolicyType;
import com.auditra.compliance.domain.ReportingPeriod;
import com.auditra.compliance.domain.Severity;
import com.auditra.compliance.domain.TimeRange;
import com.auditra.compliance.domain.Transaction;
import com.auditra.compliance.domain.ValidationResult;
import com.auditra.compliance.engine.ComplianceValidator;
import com.auditra.compliance.engine.ReferenceCurrencyNormalizer;
import com.auditra.compliance.exception.AuditTrailStoreException;
import com.auditra.compliance.exception.ComplianceValidationException;
import com.auditra.compliance.report.AuditReportSynthesizer;
import com.auditra.compliance.source.TransactionFilter;
import com.auditra.compliance.source.TransactionSource;
import com.auditra.compliance.trail.AuditTrailEntry;
import com.auditra.compliance.trail.AuditTrailFilter;
import com.auditra.compliance.trail.AuditTrailStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Orchestrates compliance runs: normalization, validation, report synthesis
 * and archiving.
 */
@Slf4j
@Service
public class ComplianceAuditService {

    private final RuleCatalogRegistry catalogRegistry;
    private final ReferenceCurrencyNormalizer normalizer;
    private final ComplianceValidator validator;
    private final AuditReportSynthesizer synthesizer;
    private final AuditTrailStore trailStore;
    private final TransactionSource transactionSource;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int defaultLookbackDays;

    private final Counter runCounter;
    private final Counter trailFailureCounter;
    private final Timer runTimer;

    public ComplianceAuditService(RuleCatalogRegistry catalogRegistry,
                                  ReferenceCurrencyNormalizer normalizer,
                                  ComplianceValidator validator,
                                  AuditReportSynthesizer synthesizer,
                                  AuditTrailStore trailStore,
                                  TransactionSource transactionSource,
                                  MeterRegistry meterRegistry,
                                  Clock clock,
                                  ComplianceProperties properties) {
        this.catalogRegistry = catalogRegistry;
        this.normalizer = normalizer;
        this.validator = validator;
        this.synthesizer = synthesizer;
        this.trailStore = trailStore;
        this.transactionSource = transactionSource;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.defaultLookbackDays = properties.getTrail().getDefaultLookbackDays();

        this.runCounter = Counter.builder("compliance.runs")
            .description("Completed compliance validation runs")
            .register(meterRegistry);
        this.trailFailureCounter = Counter.builder("compliance.trail.failures")
            .description("Reports that could not be archived to the audit trail")
            .register(meterRegistry);
        this.runTimer = Timer.builder("compliance.run.duration")
            .description("Duration of compliance validation runs")
            .register(meterRegistry);
    }

    public ValidationResult validate(List<Transaction> transactions, String policyType) {
        return validate(transactions, PolicyType.parse(policyType));
    }

    public ValidationResult validate(List<Transaction> transactions, PolicyType policyType) {
        RuleCatalog catalog = catalogRegistry.current();
        return timedValidation(transactions, policyType, catalog);
    }

    /**
     * Validation restricted to violations at or above the severity threshold
     */
    public ValidationResult checkStatus(List<Transaction> transactions, String policyType, Severity severityThreshold) {
        PolicyType type = PolicyType.parse(policyType);
        RuleCatalog catalog = catalogRegistry.current();
        return timed(transactions,
            normalized -> validator.checkStatus(normalized, type, severityThreshold, catalog));
    }

    /**
     * Validate, synthesize and archive. Archive failures are reported in the
     * result rather than thrown; validation failures abort the run before
     * anything is recorded.
     */
    public AuditRunResult generateReport(ReportCommand command) {
        PolicyType policyType = command.effectivePolicyType();
        ReportingPeriod period = command.effectivePeriod();
        RuleCatalog catalog = catalogRegistry.current();

        List<Transaction> transactions = resolveTransactions(command, period);
        ValidationResult result = timedValidation(transactions, policyType, catalog);

        Map<String, String> ruleRecommendations = AuditReportSynthesizer.recommendationsByRule(catalog.rulesFor(policyType));
        AuditReport report = synthesizer.synthesize(result.violations(), result.status(), command.getReportType(),
            period, policyType, command.isIncludeRecommendations(), ruleRecommendations);

        String scope = describeScope(command, transactions.size(), period);
        try {
            AuditTrailEntry entry = trailStore.record(report, scope);
            return AuditRunResult.archived(report, entry);
        } catch (AuditTrailStoreException e) {
            trailFailureCounter.increment();
            log.warn("Report {} generated but not archived: {}", report.getReportId(), e.getReason());
            return AuditRunResult.notArchived(report, e.getReason());
        }
    }

    /**
     * Trail entries in the window, newest first. Missing bounds default to the
     * configured lookback ending now.
     */
    public List<AuditTrailEntry> auditTrail(LocalDateTime from, LocalDateTime to, AuditTrailFilter filter) {
        LocalDateTime end = to != null ? to : LocalDateTime.now(clock);
        LocalDateTime start = from != null ? from : end.minusDays(defaultLookbackDays);
        return trailStore.query(TimeRange.of(start, end), filter != null ? filter : AuditTrailFilter.none());
    }

    public AuditTrailEntry trailEntry(Long runId) {
        return trailStore.findByRunId(runId);
    }

    public AuditReport archivedReport(AuditTrailEntry entry) {
        return trailStore.readReport(entry);
    }

    public List<ComplianceRule> rules(PolicyType policyType) {
        RuleCatalog catalog = catalogRegistry.current();
        return policyType != null ? catalog.rulesFor(policyType) : catalog.allRules();
    }

    public RuleCatalog currentCatalog() {
        return catalogRegistry.current();
    }

    public RuleCatalog reloadRules() {
        return catalogRegistry.reload();
    }

    private ValidationResult timedValidation(List<Transaction> transactions, PolicyType policyType, RuleCatalog catalog) {
        return timed(transactions, normalized -> validator.validate(normalized, policyType, catalog));
    }

    /**
     * Normalizes the batch and runs the given validation under the run timer,
     * counting the run and its violations by severity
     */
    private ValidationResult timed(List<Transaction> transactions,
                                   Function<List<Transaction>, ValidationResult> validation) {
        requireTransactions(transactions);
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            ValidationResult result = validation.apply(normalizer.normalize(transactions));
            runCounter.increment();
            result.status().getSeverityCounts().forEach((severity, count) -> {
                if (count > 0) {
                    meterRegistry.counter("compliance.violations", "severity", severity.name()).increment(count);
                }
            });
            return result;
        } finally {
            sample.stop(runTimer);
        }
    }

    private List<Transaction> resolveTransactions(ReportCommand command, ReportingPeriod period) {
        if (command.getTransactions() != null) {
            return command.getTransactions();
        }
        TransactionFilter filter = command.getTransactionFilter();
        if (filter == null) {
            filter = TransactionFilter.builder()
                .from(period.getStartDate())
                .to(period.getEndDate())
                .build();
        }
        List<Transaction> transactions = transactionSource.findTransactions(filter);
        log.info("Resolved {} transactions from store for {} report", transactions.size(), command.getReportType());
        return transactions;
    }

    private static String describeScope(ReportCommand command, int transactionCount, ReportingPeriod period) {
        String source = command.getTransactions() != null
            ? transactionCount + " submitted transactions"
            : transactionCount + " stored " + (command.getTransactionFilter() != null
                ? command.getTransactionFilter().describe()
                : "transactions");
        return String.format("%s %s, period %s", command.effectivePolicyType(), source, period.getPeriodSummary());
    }

    private static void requireTransactions(List<Transaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            throw ComplianceValidationException.emptyTransactionSet();
        }
    }
}
