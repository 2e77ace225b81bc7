package com.auditra.compliance.source;

import com.auditra.compliance.domain.RiskCategory;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Row of the transaction store. Owned by the ledger; this service only reads it.
 */
@Entity
@Immutable
@Table(name = "transactions", indexes = {
    @Index(name = "idx_tx_date", columnList = "transaction_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionRecord {

    @Id
    @Column(name = "transaction_id", length = 64)
    private String transactionId;

    @Column(name = "amount", precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "currency", length = 3)
    private String currency;

    @Column(name = "country", length = 100)
    private String country;

    @Column(name = "payment_method", length = 32)
    private String paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_category", length = 16)
    private RiskCategory riskCategory;

    @Column(name = "transaction_date")
    private LocalDateTime transactionDate;

    @Column(name = "supplier_name")
    private String supplierName;

    @Column(name = "account_reference", length = 64)
    private String accountReference;

    @Column(name = "description", length = 500)
    private String description;
}
