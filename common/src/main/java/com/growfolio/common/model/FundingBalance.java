package com.growfolio.common.model;

/*
 * 09/18/2026 - 9:43 AM
 * @author Growfolio Engineering
 */

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Cash available for investing, in both settlement currencies.
 */
@Builder(toBuilder = true)
public record FundingBalance(
        String id,
        String userId,
        String portfolioId,
        BigDecimal availableUsd,
        BigDecimal availableGbp,
        BigDecimal pendingDepositsUsd,
        BigDecimal pendingDepositsGbp,
        BigDecimal pendingWithdrawalsUsd,
        BigDecimal pendingWithdrawalsGbp,
        Instant updatedAt) {

    public BigDecimal available(String currency) {
        BigDecimal amount = "USD".equalsIgnoreCase(currency) ? availableUsd : availableGbp;
        return amount != null ? amount : BigDecimal.ZERO;
    }

    public boolean hasPendingTransactions() {
        return positive(pendingDepositsUsd) || positive(pendingDepositsGbp)
                || positive(pendingWithdrawalsUsd) || positive(pendingWithdrawalsGbp);
    }

    private static boolean positive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
