package com.auditra.compliance.dto;

import com.auditra.compliance.domain.ComplianceStatus;
import com.auditra.compliance.domain.PolicyType;
import com.auditra.compliance.domain.Violation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResultResponse {
    private PolicyType policyType;
    private List<Violation> violations;
    private ComplianceStatus status;
}
