package com.auditra.compliance.engine;

import com.auditra.compliance.config.ComplianceProperties;
import com.auditra.compliance.domain.Transaction;
import com.auditra.compliance.exception.ComplianceValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts transaction amounts into the reference currency before rule evaluation,
 * using the static rates from configuration.
 */
@Slf4j
@Component
public class ReferenceCurrencyNormalizer {

    private final String referenceCurrency;
    private final Map<String, BigDecimal> rates;

    public ReferenceCurrencyNormalizer(ComplianceProperties properties) {
        this.referenceCurrency = properties.getCurrency().getReferenceCurrency().toUpperCase();
        this.rates = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        this.rates.putAll(properties.getCurrency().getRates());
    }

    public String getReferenceCurrency() {
        return referenceCurrency;
    }

    public List<Transaction> normalize(List<Transaction> transactions) {
        if (transactions == null) {
            return List.of();
        }
        return transactions.stream().map(this::normalize).toList();
    }

    /**
     * A transaction without a currency is taken to be in the reference currency already.
     *
     * @throws ComplianceValidationException if no rate is configured for the transaction currency
     */
    public Transaction normalize(Transaction transaction) {
        if (transaction == null) {
            return null;
        }
        String currency = transaction.getCurrency();
        if (currency == null || currency.isBlank() || currency.equalsIgnoreCase(referenceCurrency)) {
            return transaction.getCurrency() != null && transaction.getCurrency().equals(referenceCurrency)
                ? transaction
                : transaction.toBuilder().currency(referenceCurrency).build();
        }
        BigDecimal rate = rates.get(currency.trim());
        if (rate == null) {
            throw ComplianceValidationException.unsupportedCurrency(transaction.getTransactionId(), currency);
        }
        BigDecimal converted = transaction.getAmount() == null
            ? null
            : transaction.getAmount().multiply(rate).setScale(2, RoundingMode.HALF_UP);
        log.debug("Normalized transaction {} from {} {} to {} {}",
            transaction.getTransactionId(), transaction.getAmount(), currency, converted, referenceCurrency);
        return transaction.toBuilder()
            .amount(converted)
            .currency(referenceCurrency)
            .build();
    }
}
