package com.auditra.compliance.exception;

import com.auditra.common.exception.BusinessException;
import com.auditra.common.exception.ErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Malformed or missing rule configuration. Fatal at startup; on reload the
 * previously active catalog stays in place.
 */
public class CatalogException extends BusinessException {

    private final List<String> problems;

    public CatalogException(String message) {
        super(ErrorCode.COMPLIANCE_CATALOG_INVALID, message);
        this.problems = List.of(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(ErrorCode.COMPLIANCE_CATALOG_INVALID, message, cause);
        this.problems = List.of(message);
    }

    public CatalogException(String source, List<String> problems) {
        super(ErrorCode.COMPLIANCE_CATALOG_INVALID,
            String.format("Rule catalog %s is invalid: %d problem(s): %s", source, problems.size(), String.join("; ", problems)),
            Map.of("source", source, "problems", List.copyOf(problems)));
        this.problems = new ArrayList<>(problems);
    }

    public List<String> getProblems() {
        return new ArrayList<>(problems);
    }
}
