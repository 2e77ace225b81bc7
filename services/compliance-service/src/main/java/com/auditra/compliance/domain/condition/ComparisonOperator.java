package com.auditra.compliance.domain.condition;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Optional;

public enum ComparisonOperator {

    GREATER_THAN(">", "exceeds"),
    GREATER_THAN_OR_EQUAL(">=", "meets or exceeds");

    private final String symbol;
    private final String verb;

    ComparisonOperator(String symbol, String verb) {
        this.symbol = symbol;
        this.verb = verb;
    }

    public String getSymbol() { return symbol; }
    public String getVerb() { return verb; }

    public boolean test(BigDecimal amount, BigDecimal threshold) {
        int comparison = amount.compareTo(threshold);
        return this == GREATER_THAN ? comparison > 0 : comparison >= 0;
    }

    /**
     * Accepts either the symbol (">", ">=") or the constant name
     */
    public static Optional<ComparisonOperator> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
            .filter(op -> op.symbol.equals(normalized) || op.name().equalsIgnoreCase(normalized))
            .findFirst();
    }
}
