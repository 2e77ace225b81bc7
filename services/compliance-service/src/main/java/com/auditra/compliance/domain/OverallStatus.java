package com.auditra.compliance.domain;

public enum OverallStatus {
    COMPLIANT,
    NON_COMPLIANT
}
