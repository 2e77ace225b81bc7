package com.auditra.compliance.domain;

import com.auditra.compliance.exception.ComplianceValidationException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;

/**
 * Period covered by an audit report.
 *
 * Provides preset factories for the usual reporting cycles. All factories take a
 * {@link Clock} so the period boundaries are reproducible in tests.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportingPeriod {

    /**
     * Period start date and time, inclusive
     */
    private LocalDateTime startDate;

    /**
     * Period end date and time, inclusive
     */
    private LocalDateTime endDate;

    private PeriodType periodType;

    /**
     * Human-readable period name
     */
    private String periodName;

    public enum PeriodType {
        DAILY("Daily"),
        MONTHLY("Monthly"),
        QUARTERLY("Quarterly"),
        ANNUALLY("Annual"),
        ROLLING_30_DAYS("Rolling 30 Days"),
        CUSTOM("Custom"),
        ALL_TIME("All Time");

        private final String displayName;

        PeriodType(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() { return displayName; }
    }

    @JsonIgnore
    public long getDurationInDays() {
        if (startDate == null || endDate == null) return 0;
        return ChronoUnit.DAYS.between(startDate.toLocalDate(), endDate.toLocalDate()) + 1;
    }

    @JsonIgnore
    public String getPeriodSummary() {
        if (periodName != null && !periodName.isBlank()) {
            return periodName;
        }
        if (startDate == null || endDate == null) {
            return "all";
        }
        return String.format("%s to %s (%d days)", startDate.toLocalDate(), endDate.toLocalDate(), getDurationInDays());
    }

    public static ReportingPeriod allTime() {
        return ReportingPeriod.builder()
            .periodType(PeriodType.ALL_TIME)
            .periodName("all")
            .build();
    }

    public static ReportingPeriod today(Clock clock) {
        LocalDate today = LocalDate.now(clock);
        return ReportingPeriod.builder()
            .startDate(today.atStartOfDay())
            .endDate(today.atTime(LocalTime.MAX))
            .periodType(PeriodType.DAILY)
            .periodName("Day " + today)
            .build();
    }

    public static ReportingPeriod currentMonth(Clock clock) {
        LocalDate firstOfMonth = LocalDate.now(clock).withDayOfMonth(1);
        return ReportingPeriod.builder()
            .startDate(firstOfMonth.atStartOfDay())
            .endDate(firstOfMonth.plusMonths(1).atStartOfDay().minusNanos(1))
            .periodType(PeriodType.MONTHLY)
            .periodName("Month " + firstOfMonth.getYear() + "-" + String.format("%02d", firstOfMonth.getMonthValue()))
            .build();
    }

    public static ReportingPeriod currentQuarter(Clock clock) {
        LocalDate now = LocalDate.now(clock);
        int quarter = ((now.getMonthValue() - 1) / 3) + 1;
        LocalDate start = LocalDate.of(now.getYear(), (quarter - 1) * 3 + 1, 1);
        return ReportingPeriod.builder()
            .startDate(start.atStartOfDay())
            .endDate(start.plusMonths(3).atStartOfDay().minusNanos(1))
            .periodType(PeriodType.QUARTERLY)
            .periodName("Q" + quarter + " " + now.getYear())
            .build();
    }

    public static ReportingPeriod currentYear(Clock clock) {
        LocalDate start = LocalDate.now(clock).withDayOfYear(1);
        return ReportingPeriod.builder()
            .startDate(start.atStartOfDay())
            .endDate(start.plusYears(1).atStartOfDay().minusNanos(1))
            .periodType(PeriodType.ANNUALLY)
            .periodName("Year " + start.getYear())
            .build();
    }

    public static ReportingPeriod rolling30Days(Clock clock) {
        LocalDate today = LocalDate.now(clock);
        return ReportingPeriod.builder()
            .startDate(today.minusDays(30).atStartOfDay())
            .endDate(today.atTime(LocalTime.MAX))
            .periodType(PeriodType.ROLLING_30_DAYS)
            .periodName("Last 30 Days")
            .build();
    }

    public static ReportingPeriod custom(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null || start.isAfter(end)) {
            throw ComplianceValidationException.invalidInput(
                String.format("Invalid custom reporting period: %s to %s", start, end));
        }
        return ReportingPeriod.builder()
            .startDate(start)
            .endDate(end)
            .periodType(PeriodType.CUSTOM)
            .build();
    }

    /**
     * Resolve a preset by type. CUSTOM needs explicit bounds and is rejected here.
     */
    public static ReportingPeriod of(PeriodType type, Clock clock) {
        switch (type) {
            case DAILY:
                return today(clock);
            case MONTHLY:
                return currentMonth(clock);
            case QUARTERLY:
                return currentQuarter(clock);
            case ANNUALLY:
                return currentYear(clock);
            case ROLLING_30_DAYS:
                return rolling30Days(clock);
            case ALL_TIME:
                return allTime();
            default:
                throw ComplianceValidationException.invalidInput("Custom reporting period requires start and end dates");
        }
    }
}
