package com.auditra.compliance.source;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * Selection criteria for transactions pulled from the store. Null fields are not applied.
 */
@Data
@Builder
public class TransactionFilter {

    private LocalDateTime from;
    private LocalDateTime to;
    private Set<String> countries;
    private Set<String> paymentMethods;
    private String supplierName;
    private Integer limit;

    public String describe() {
        StringBuilder description = new StringBuilder("transactions");
        if (from != null || to != null) {
            description.append(" from ").append(from != null ? from : "start").append(" to ").append(to != null ? to : "now");
        }
        if (countries != null && !countries.isEmpty()) {
            description.append(", countries ").append(countries);
        }
        if (paymentMethods != null && !paymentMethods.isEmpty()) {
            description.append(", payment methods ").append(paymentMethods);
        }
        if (supplierName != null) {
            description.append(", supplier ").append(supplierName);
        }
        if (limit != null) {
            description.append(", limit ").append(limit);
        }
        return description.toString();
    }
}
