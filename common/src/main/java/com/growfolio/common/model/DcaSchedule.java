package com.growfolio.common.model;

/*
 * 09/18/2026 - 9:16 AM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonProperty;
import com.growfolio.common.enums.DcaFrequency;
import com.growfolio.common.enums.DcaScheduleStatus;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Recurring (dollar-cost averaging) investment schedule.
 */
@Builder(toBuilder = true)
public record DcaSchedule(
        String id,
        String userId,
        String stockSymbol,
        String stockName,
        BigDecimal amount,
        DcaFrequency frequency,
        Integer preferredDayOfWeek,
        Integer preferredDayOfMonth,
        Instant startDate,
        Instant endDate,
        Instant nextExecutionDate,
        Instant lastExecutionDate,
        String portfolioId,
        @JsonProperty("is_active") boolean isActive,
        @JsonProperty("is_paused") boolean isPaused,
        BigDecimal totalInvested,
        int executionCount,
        Instant createdAt,
        Instant updatedAt) {

    public boolean hasEnded(Instant now) {
        return endDate != null && endDate.isBefore(now);
    }

    /**
     * Status as seen at {@code now}. Order matters: an inactive schedule is completed even if paused.
     */
    public DcaScheduleStatus status(Instant now) {
        if (!isActive) {
            return DcaScheduleStatus.COMPLETED;
        }
        if (isPaused) {
            return DcaScheduleStatus.PAUSED;
        }
        if (hasEnded(now)) {
            return DcaScheduleStatus.COMPLETED;
        }
        if (nextExecutionDate != null && !nextExecutionDate.isAfter(now)) {
            return DcaScheduleStatus.PENDING_EXECUTION;
        }
        return DcaScheduleStatus.ACTIVE;
    }

    /**
     * Annualised amount, used for the monthly equivalent in summaries.
     */
    public BigDecimal annualAmount() {
        int perYear = switch (frequency != null ? frequency : DcaFrequency.MONTHLY) {
            case DAILY -> 252;
            case WEEKLY -> 52;
            case BIWEEKLY -> 26;
            case MONTHLY -> 12;
            case QUARTERLY -> 4;
        };
        return (amount != null ? amount : BigDecimal.ZERO).multiply(BigDecimal.valueOf(perYear));
    }
}
