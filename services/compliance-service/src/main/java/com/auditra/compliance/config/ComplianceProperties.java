package com.auditra.compliance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "compliance")
public class ComplianceProperties {

    private CatalogProperties catalog = new CatalogProperties();
    private EvaluationProperties evaluation = new EvaluationProperties();
    private ReportProperties report = new ReportProperties();
    private CurrencyProperties currency = new CurrencyProperties();
    private TrailProperties trail = new TrailProperties();

    @Data
    public static class CatalogProperties {
        private String location = "classpath:rules/compliance-rules.yml";
    }

    @Data
    public static class EvaluationProperties {
        private boolean parallelEnabled = true;
        private int parallelThreshold = 500;
        private int threads = Math.max(2, Runtime.getRuntime().availableProcessors());
    }

    @Data
    public static class ReportProperties {
        /**
         * Violation count above which a report recommends escalation
         */
        private int escalationThreshold = 10;
    }

    @Data
    public static class CurrencyProperties {
        private String referenceCurrency = "EUR";
        /**
         * Units of reference currency per one unit of the keyed currency
         */
        private Map<String, BigDecimal> rates = new LinkedHashMap<>();
    }

    @Data
    public static class TrailProperties {
        private int defaultLookbackDays = 30;
    }
}
