package com.auditra.compliance.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Immutable transaction fact handed to the engine by the transaction store.
 * Amounts are expected in the reference currency by the time rules are evaluated.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public class Transaction {

    private final String transactionId;
    private final BigDecimal amount;
    private final String currency;
    private final String country;
    private final String paymentMethod;
    private final RiskCategory riskCategory;
    private final LocalDateTime transactionDate;
    private final String supplierName;
    private final String accountReference;
    private final String description;
}
