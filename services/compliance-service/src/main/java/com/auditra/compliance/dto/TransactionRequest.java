package com.auditra.compliance.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Transaction submitted inline with a validation or report request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionRequest {
    @NotBlank
    private String transactionId;

    @NotNull
    private BigDecimal amount;

    @Pattern(regexp = "^[A-Za-z]{3}$", message = "currency must be an ISO 4217 code")
    private String currency;

    private String country;
    private String paymentMethod;
    private String riskCategory; // LOW, MEDIUM, HIGH, PEP
    private LocalDateTime transactionDate;
    private String supplierName;
    private String accountReference;
    private String description;
}
