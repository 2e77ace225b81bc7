package com.auditra.compliance.domain.condition;

/**
 * Tag of a rule condition variant
 */
public enum ConditionType {
    AMOUNT_THRESHOLD,
    COUNTRY_SET,
    PAYMENT_METHOD_SET,
    RISK_CATEGORY_SET
}
