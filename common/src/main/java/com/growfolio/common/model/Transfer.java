package com.growfolio.common.model;

/*
 * 09/18/2026 - 11:57 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.enums.TransferStatus;
import com.growfolio.common.enums.TransferType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Deposit into or withdrawal out of the funding account.
 */
@Builder(toBuilder = true)
public record Transfer(
        String id,
        String userId,
        String portfolioId,
        TransferType type,
        TransferStatus status,
        BigDecimal amount,
        String currency,
        BigDecimal amountUsd,
        BigDecimal fxRate,
        BigDecimal fees,
        String bankAccountId,
        String referenceNumber,
        String notes,
        Instant initiatedAt,
        Instant completedAt,
        Instant expectedCompletionDate,
        String failureReason,
        Instant createdAt,
        Instant updatedAt) {

    public BigDecimal netAmount() {
        BigDecimal gross = amount != null ? amount : BigDecimal.ZERO;
        return gross.subtract(fees != null ? fees : BigDecimal.ZERO);
    }

    public boolean canCancel() {
        return status != null && status.isCancellable();
    }

    public boolean isInProgress() {
        return status == TransferStatus.PENDING || status == TransferStatus.PROCESSING;
    }
}
