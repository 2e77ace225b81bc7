package com.auditra.compliance.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleCatalogResponse {
    private String version;
    private int totalRules;
    private List<RuleResponse> rules;
}
