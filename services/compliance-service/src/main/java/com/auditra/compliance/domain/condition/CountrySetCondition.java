package com.auditra.compliance.domain.condition;

import com.auditra.compliance.domain.Transaction;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Matches when the counterparty country is in the set. Comparison ignores case.
 */
@Getter
@EqualsAndHashCode
@ToString
public class CountrySetCondition implements RuleCondition {

    private final Set<String> countries;
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @Getter(AccessLevel.NONE)
    private final Set<String> normalized;

    public CountrySetCondition(Collection<String> countries) {
        this.countries = Collections.unmodifiableSet(new TreeSet<>(countries));
        this.normalized = countries.stream()
            .map(CountrySetCondition::normalize)
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public ConditionType getType() {
        return ConditionType.COUNTRY_SET;
    }

    @Override
    public boolean matches(Transaction transaction) {
        return transaction.getCountry() != null && normalized.contains(normalize(transaction.getCountry()));
    }

    @Override
    public String describe(Transaction transaction) {
        return "counterparty country " + transaction.getCountry() + " is on the listed countries";
    }

    @Override
    public String summary() {
        return "country in " + countries;
    }

    private static String normalize(String country) {
        return country.trim().toLowerCase(Locale.ROOT);
    }
}
