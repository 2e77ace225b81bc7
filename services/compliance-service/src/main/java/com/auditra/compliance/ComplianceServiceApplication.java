package com.auditra.compliance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Compliance Service Application
 *
 * AML policy engine for the Auditra platform:
 * - Rule catalog loaded from versioned YAML, reloadable at runtime
 * - Transaction validation against AML, financial and regulatory policies
 * - Audit report synthesis with deterministic recommendations
 * - Append-only audit trail of every generated report
 */
@SpringBootApplication
public class ComplianceServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComplianceServiceApplication.class, args);
    }
}
