package com.auditra.compliance.domain.condition;

import com.auditra.compliance.domain.Transaction;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

@Getter
@EqualsAndHashCode
@ToString
public class AmountThresholdCondition implements RuleCondition {

    private static final Map<String, String> SYMBOLS = Map.of(
        "EUR", "\u20AC",
        "USD", "$",
        "GBP", "\u00A3",
        "JPY", "\u00A5");

    private final BigDecimal threshold;
    private final ComparisonOperator operator;
    private final String currency;

    public AmountThresholdCondition(BigDecimal threshold, ComparisonOperator operator, String currency) {
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    @Override
    public ConditionType getType() {
        return ConditionType.AMOUNT_THRESHOLD;
    }

    @Override
    public boolean matches(Transaction transaction) {
        return transaction.getAmount() != null && operator.test(transaction.getAmount(), threshold);
    }

    @Override
    public String describe(Transaction transaction) {
        return String.format("Transaction amount %s %s %s threshold",
            money(transaction.getAmount()), operator.getVerb(), money(threshold));
    }

    @Override
    public String summary() {
        return String.format(Locale.ROOT, "amount %s %s %,.2f", operator.getSymbol(), currency, threshold);
    }

    private String money(BigDecimal amount) {
        String formatted = String.format(Locale.ROOT, "%,.2f", amount);
        String symbol = SYMBOLS.get(currency);
        return symbol != null ? symbol + formatted : currency + " " + formatted;
    }
}
