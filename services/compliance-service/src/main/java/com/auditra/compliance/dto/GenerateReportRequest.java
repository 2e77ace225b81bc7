package com.auditra.compliance.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Report generation request. Either inline transactions or a transaction filter;
 * with neither, stored transactions of the reporting period are evaluated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateReportRequest {
    @NotBlank
    private String reportType;

    private String policyType; // defaults to the report type's policy

    private String periodType; // DAILY, MONTHLY, QUARTERLY, ANNUALLY, ROLLING_30_DAYS, CUSTOM, ALL_TIME
    private LocalDateTime periodStart;
    private LocalDateTime periodEnd;

    @Builder.Default
    private Boolean includeRecommendations = true;

    private List<@Valid TransactionRequest> transactions;

    @Valid
    private TransactionFilterRequest transactionFilter;
}
