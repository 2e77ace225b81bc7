package com.auditra.compliance.dto;

import com.auditra.compliance.domain.PolicyType;
import com.auditra.compliance.domain.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleResponse {
    private String ruleId;
    private String name;
    private String description;
    private PolicyType policyType;
    private Severity severity;
    private List<String> conditions;
    private String remediationAction;
    private String recommendation;
    private List<String> requirements;
}
