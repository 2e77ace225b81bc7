package com.auditra.compliance.source;

import com.auditra.compliance.domain.Transaction;

import java.util.List;

/**
 * Read-only access to the transactions a report evaluates
 */
public interface TransactionSource {

    /**
     * Transactions matching the filter, ordered by transaction date then id
     */
    List<Transaction> findTransactions(TransactionFilter filter);
}
