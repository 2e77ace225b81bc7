package com.auditra.compliance.source;

import com.auditra.compliance.domain.Transaction;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaTransactionSource implements TransactionSource {

    private static final Sort BY_DATE = Sort.by(Sort.Order.asc("transactionDate"), Sort.Order.asc("transactionId"));

    private final TransactionRecordRepository repository;

    @Override
    @Transactional(readOnly = true)
    public List<Transaction> findTransactions(TransactionFilter filter) {
        TransactionFilter effective = filter != null ? filter : TransactionFilter.builder().build();
        Specification<TransactionRecord> specification = toSpecification(effective);

        List<TransactionRecord> records = effective.getLimit() != null && effective.getLimit() > 0
            ? repository.findAll(specification, PageRequest.of(0, effective.getLimit(), BY_DATE)).getContent()
            : repository.findAll(specification, BY_DATE);

        log.debug("Loaded {} {}", records.size(), effective.describe());
        return records.stream().map(JpaTransactionSource::toTransaction).toList();
    }

    private static Specification<TransactionRecord> toSpecification(TransactionFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.getFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<LocalDateTime>get("transactionDate"), filter.getFrom()));
            }
            if (filter.getTo() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<LocalDateTime>get("transactionDate"), filter.getTo()));
            }
            if (filter.getCountries() != null && !filter.getCountries().isEmpty()) {
                predicates.add(cb.lower(root.<String>get("country")).in(lowerCase(filter.getCountries())));
            }
            if (filter.getPaymentMethods() != null && !filter.getPaymentMethods().isEmpty()) {
                predicates.add(cb.upper(root.<String>get("paymentMethod")).in(filter.getPaymentMethods().stream()
                    .map(method -> method.toUpperCase(Locale.ROOT)).collect(Collectors.toSet())));
            }
            if (filter.getSupplierName() != null) {
                predicates.add(cb.equal(root.get("supplierName"), filter.getSupplierName()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static List<String> lowerCase(Collection<String> values) {
        return values.stream().map(value -> value.toLowerCase(Locale.ROOT)).toList();
    }

    static Transaction toTransaction(TransactionRecord record) {
        return Transaction.builder()
            .transactionId(record.getTransactionId())
            .amount(record.getAmount())
            .currency(record.getCurrency())
            .country(record.getCountry())
            .paymentMethod(record.getPaymentMethod())
            .riskCategory(record.getRiskCategory())
            .transactionDate(record.getTransactionDate())
            .supplierName(record.getSupplierName())
            .accountReference(record.getAccountReference())
            .description(record.getDescription())
            .build();
    }
}
