package com.growfolio.common.model;

/*
 * 09/18/2026 - 10:18 AM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonProperty;
import com.growfolio.common.enums.LedgerEntryType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

@Builder(toBuilder = true)
public record LedgerEntry(
        String id,
        String portfolioId,
        String userId,
        LedgerEntryType type,
        String stockSymbol,
        String stockName,
        BigDecimal quantity,
        BigDecimal pricePerShare,
        BigDecimal totalAmount,
        BigDecimal fees,
        String currencyCode,
        Instant transactionDate,
        String notes,
        String source,
        String referenceId,
        @JsonProperty("is_reconciled") boolean isReconciled,
        Instant createdAt,
        Instant updatedAt) {
}
