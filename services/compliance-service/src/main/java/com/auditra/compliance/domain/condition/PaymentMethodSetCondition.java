package com.auditra.compliance.domain.condition;

import com.auditra.compliance.domain.Transaction;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Matches when the payment method is in the set. Methods are compared upper-cased.
 */
@Getter
@EqualsAndHashCode
@ToString
public class PaymentMethodSetCondition implements RuleCondition {

    private final Set<String> paymentMethods;

    public PaymentMethodSetCondition(Collection<String> paymentMethods) {
        TreeSet<String> methods = new TreeSet<>();
        paymentMethods.forEach(method -> methods.add(normalize(method)));
        this.paymentMethods = Collections.unmodifiableSet(methods);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.PAYMENT_METHOD_SET;
    }

    @Override
    public boolean matches(Transaction transaction) {
        return transaction.getPaymentMethod() != null
            && paymentMethods.contains(normalize(transaction.getPaymentMethod()));
    }

    @Override
    public String describe(Transaction transaction) {
        return "payment method " + normalize(transaction.getPaymentMethod()) + " is one of " + paymentMethods;
    }

    @Override
    public String summary() {
        return "payment method in " + paymentMethods;
    }

    private static String normalize(String method) {
        return method.trim().toUpperCase(Locale.ROOT);
    }
}
