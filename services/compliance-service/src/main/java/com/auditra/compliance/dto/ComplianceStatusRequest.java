package com.auditra.compliance.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceStatusRequest {
    @NotBlank
    private String policyType;

    private String severityThreshold; // defaults to LOW

    @NotNull
    private List<@Valid TransactionRequest> transactions;
}
