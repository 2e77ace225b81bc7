package com.auditra.compliance.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * A single rule trigger tied to one transaction and one rule
 */
@Getter
@Builder
@Jacksonized
@EqualsAndHashCode
@ToString
public class Violation {

    private final String transactionId;
    private final String ruleId;
    private final String ruleName;
    private final Severity severity;
    private final String explanation;
    private final String remediationAction;

    // Transaction context, copied so the violation reads on its own in reports
    private final BigDecimal amount;
    private final String currency;
    private final String country;
    private final String paymentMethod;
    private final RiskCategory riskCategory;
    private final String supplierName;
}
