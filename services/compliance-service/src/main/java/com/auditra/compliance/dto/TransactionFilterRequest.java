package com.auditra.compliance.dto;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionFilterRequest {
    private LocalDateTime from;
    private LocalDateTime to;
    private Set<String> countries;
    private Set<String> paymentMethods;
    private String supplierName;

    @Positive
    private Integer limit;
}
