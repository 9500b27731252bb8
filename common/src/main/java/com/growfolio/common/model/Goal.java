package com.growfolio.common.model;

/*
 * 09/18/2026 - 10:01 AM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonProperty;
import com.growfolio.common.enums.GoalCategory;
import lombok.Builder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

/**
 * Savings goal, optionally linked to a portfolio and to recurring investments.
 */
@Builder(toBuilder = true)
public record Goal(
        String id,
        String userId,
        String name,
        BigDecimal targetAmount,
        BigDecimal currentAmount,
        Instant targetDate,
        String linkedPortfolioId,
        List<String> linkedDcaScheduleIds,
        GoalCategory category,
        String iconName,
        String colorHex,
        String notes,
        @JsonProperty("is_archived") boolean isArchived,
        Instant createdAt,
        Instant updatedAt) {

    public Goal {
        linkedDcaScheduleIds = linkedDcaScheduleIds != null ? List.copyOf(linkedDcaScheduleIds) : List.of();
    }

    /**
     * Progress towards the target as a ratio; 0 when no target is set.
     */
    public double progress() {
        if (targetAmount == null || targetAmount.signum() <= 0 || currentAmount == null) {
            return 0.0;
        }
        return currentAmount.divide(targetAmount, 6, RoundingMode.HALF_UP).doubleValue();
    }

    public boolean isAchieved() {
        return currentAmount != null && targetAmount != null && currentAmount.compareTo(targetAmount) >= 0;
    }

    public BigDecimal remainingAmount() {
        if (isAchieved() || targetAmount == null) {
            return BigDecimal.ZERO;
        }
        return targetAmount.subtract(currentAmount != null ? currentAmount : BigDecimal.ZERO);
    }
}
