package com.auditra.compliance.domain.condition;

import com.auditra.compliance.domain.Transaction;

/**
 * One predicate of a compliance rule. Implementations are immutable and side-effect free;
 * the evaluator only ever combines them by conjunction.
 */
public interface RuleCondition {

    ConditionType getType();

    /**
     * @param transaction transaction with its amount already in the reference currency
     * @return true when the transaction satisfies this predicate
     */
    boolean matches(Transaction transaction);

    /**
     * Human-readable reason this condition matched, used to build violation explanations.
     * Only called for transactions where {@link #matches(Transaction)} returned true.
     */
    String describe(Transaction transaction);

    /**
     * Transaction-independent form of the predicate, e.g. {@code amount >= EUR 100,000.00}
     */
    String summary();
}
