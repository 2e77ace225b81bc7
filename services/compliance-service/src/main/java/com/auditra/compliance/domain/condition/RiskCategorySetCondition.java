package com.auditra.compliance.domain.condition;

import com.auditra.compliance.domain.RiskCategory;
import com.auditra.compliance.domain.Transaction;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

@Getter
@EqualsAndHashCode
@ToString
public class RiskCategorySetCondition implements RuleCondition {

    private final Set<RiskCategory> riskCategories;

    public RiskCategorySetCondition(Collection<RiskCategory> riskCategories) {
        this.riskCategories = Collections.unmodifiableSet(EnumSet.copyOf(riskCategories));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.RISK_CATEGORY_SET;
    }

    @Override
    public boolean matches(Transaction transaction) {
        return transaction.getRiskCategory() != null && riskCategories.contains(transaction.getRiskCategory());
    }

    @Override
    public String describe(Transaction transaction) {
        return "risk category " + transaction.getRiskCategory() + " is one of " + riskCategories;
    }

    @Override
    public String summary() {
        return "risk category in " + riskCategories;
    }
}
