package com.auditra.compliance.dto;

import com.auditra.compliance.domain.AuditReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditRunResponse {
    private AuditReport report;
    private Long runId;
    private boolean archived;
    private String archiveError;
}
