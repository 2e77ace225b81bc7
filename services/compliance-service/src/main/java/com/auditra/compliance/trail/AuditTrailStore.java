package com.auditra.compliance.trail;

import com.auditra.compliance.domain.AuditReport;
import com.auditra.compliance.domain.TimeRange;
import com.auditra.compliance.exception.AuditTrailEntryNotFoundException;
import com.auditra.compliance.exception.AuditTrailStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only archive of audit runs.
 *
 * Writes go through a single lock so run ids and recorded timestamps advance
 * together. Each entry is persisted and flushed in its own repository
 * transaction before the lock is released.
 */
@Slf4j
@Component
public class AuditTrailStore {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("recordedAt"), Sort.Order.desc("runId"));

    private final AuditTrailEntryRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    public AuditTrailStore(AuditTrailEntryRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Archive a report together with a description of the evaluated scope
     *
     * @throws AuditTrailStoreException if the report cannot be serialized or persisted
     */
    public AuditTrailEntry record(AuditReport report, String scopeDescription) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new AuditTrailStoreException("Failed to serialize audit report " + report.getReportId(), e);
        }

        writeLock.lock();
        try {
            AuditTrailEntry entry = AuditTrailEntry.builder()
                .recordedAt(LocalDateTime.now(clock))
                .scopeDescription(scopeDescription)
                .reportId(report.getReportId())
                .reportType(report.getReportType())
                .policyType(report.getPolicyType())
                .overallStatus(report.getStatus().getOverallStatus())
                .highestSeverity(report.getStatus().getHighestSeverity())
                .totalTransactions(report.getStatus().getTotalTransactions())
                .totalViolations(report.getStatus().getTotalViolations())
                .reportPayload(payload)
                .build();
            AuditTrailEntry saved = repository.saveAndFlush(entry);
            log.info("Archived {} report {} as run {}", report.getReportType(), report.getReportId(), saved.getRunId());
            return saved;
        } catch (DataAccessException e) {
            log.error("Failed to archive report {}: {}", report.getReportId(), e.getMessage());
            throw new AuditTrailStoreException("Failed to archive audit report " + report.getReportId(), e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Entries recorded within the range, newest first; ties broken by run id descending.
     * Empty when nothing matches.
     */
    public List<AuditTrailEntry> query(TimeRange range, AuditTrailFilter filter) {
        try {
            return repository.findAll(AuditTrailSpecifications.matching(range, filter), NEWEST_FIRST);
        } catch (DataAccessException e) {
            throw new AuditTrailStoreException("Failed to query audit trail", e);
        }
    }

    public AuditTrailEntry findByRunId(Long runId) {
        try {
            return repository.findById(runId).orElseThrow(() -> new AuditTrailEntryNotFoundException(runId));
        } catch (DataAccessException e) {
            throw new AuditTrailStoreException("Failed to read audit trail entry " + runId, e);
        }
    }

    /**
     * Restore the archived report of an entry
     */
    public AuditReport readReport(AuditTrailEntry entry) {
        try {
            return objectMapper.readValue(entry.getReportPayload(), AuditReport.class);
        } catch (JsonProcessingException e) {
            throw new AuditTrailStoreException("Archived report of run " + entry.getRunId() + " is unreadable", e);
        }
    }
}
